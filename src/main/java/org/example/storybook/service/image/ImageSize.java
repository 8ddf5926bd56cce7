package org.example.storybook.service.image;

public enum ImageSize {
    SQUARE("1024x1024"),
    LANDSCAPE("1536x1024"),
    PORTRAIT("1024x1536");

    private final String wireValue;

    ImageSize(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
