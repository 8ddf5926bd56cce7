package org.example.storybook.model;

public class StoryPage {

    private final int pageNumber;
    private String text;
    private String imageUrl;
    private String imagePrompt;

    public StoryPage(int pageNumber, String text) {
        this.pageNumber = pageNumber;
        this.text = text;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getImagePrompt() {
        return imagePrompt;
    }

    public void setImagePrompt(String imagePrompt) {
        this.imagePrompt = imagePrompt;
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
