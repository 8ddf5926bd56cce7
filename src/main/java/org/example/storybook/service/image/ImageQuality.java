package org.example.storybook.service.image;

public enum ImageQuality {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireValue;

    ImageQuality(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
