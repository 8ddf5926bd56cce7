package org.example.storybook.service.image;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Output items of an OpenAI Responses API reply, decoded by their "type" tag.
 * Types we do not use decode to {@link Other}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = ResponseOutputItem.Other.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ResponseOutputItem.ImageGenerationCall.class, name = "image_generation_call"),
    @JsonSubTypes.Type(value = ResponseOutputItem.Message.class, name = "message")
})
public interface ResponseOutputItem {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ImageGenerationCall(String id, String status, String result) implements ResponseOutputItem {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String id, List<ContentItem> content) implements ResponseOutputItem {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Other() implements ResponseOutputItem {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentItem(String type, String url, String text) {

        boolean isImage() {
            return ("output_image".equals(type) || "image".equals(type)) && url != null && !url.isBlank();
        }
    }
}
