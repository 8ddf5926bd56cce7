package org.example.storybook.service.image;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record ResponsesReply(String id, String status, List<ResponseOutputItem> output) {}
