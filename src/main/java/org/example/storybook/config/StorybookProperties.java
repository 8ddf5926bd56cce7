package org.example.storybook.config;

import org.example.storybook.service.image.ImageQuality;
import org.example.storybook.service.image.ImageSize;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "storybook")
public class StorybookProperties {

    private Prompt prompt = new Prompt();
    private Images images = new Images();
    private Defaults defaults = new Defaults();

    public Prompt getPrompt() {
        return prompt;
    }

    public void setPrompt(Prompt prompt) {
        this.prompt = prompt == null ? new Prompt() : prompt;
    }

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images == null ? new Images() : images;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults == null ? new Defaults() : defaults;
    }

    public static class Prompt {
        private int maxLength = 1500;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }

    public static class Images {
        private ImageSize pageSize = ImageSize.SQUARE;
        private ImageQuality pageQuality = ImageQuality.HIGH;
        private ImageSize artBibleSize = ImageSize.LANDSCAPE;
        private ImageQuality artBibleQuality = ImageQuality.LOW;
        private ImageSize characterReferenceSize = ImageSize.LANDSCAPE;
        private ImageQuality characterReferenceQuality = ImageQuality.LOW;
        private boolean characterTurnaround = true;

        public ImageSize getPageSize() {
            return pageSize;
        }

        public void setPageSize(ImageSize pageSize) {
            this.pageSize = pageSize;
        }

        public ImageQuality getPageQuality() {
            return pageQuality;
        }

        public void setPageQuality(ImageQuality pageQuality) {
            this.pageQuality = pageQuality;
        }

        public ImageSize getArtBibleSize() {
            return artBibleSize;
        }

        public void setArtBibleSize(ImageSize artBibleSize) {
            this.artBibleSize = artBibleSize;
        }

        public ImageQuality getArtBibleQuality() {
            return artBibleQuality;
        }

        public void setArtBibleQuality(ImageQuality artBibleQuality) {
            this.artBibleQuality = artBibleQuality;
        }

        public ImageSize getCharacterReferenceSize() {
            return characterReferenceSize;
        }

        public void setCharacterReferenceSize(ImageSize characterReferenceSize) {
            this.characterReferenceSize = characterReferenceSize;
        }

        public ImageQuality getCharacterReferenceQuality() {
            return characterReferenceQuality;
        }

        public void setCharacterReferenceQuality(ImageQuality characterReferenceQuality) {
            this.characterReferenceQuality = characterReferenceQuality;
        }

        public boolean isCharacterTurnaround() {
            return characterTurnaround;
        }

        public void setCharacterTurnaround(boolean characterTurnaround) {
            this.characterTurnaround = characterTurnaround;
        }

        /**
         * Single-pose references are square; turnaround sheets need the wide format.
         */
        public ImageSize effectiveCharacterReferenceSize() {
            return characterTurnaround ? characterReferenceSize : ImageSize.SQUARE;
        }
    }

    public static class Defaults {
        private String artStyle = "cartoon";
        private int wordsPerPage = 50;

        public String getArtStyle() {
            return artStyle;
        }

        public void setArtStyle(String artStyle) {
            this.artStyle = artStyle;
        }

        public int getWordsPerPage() {
            return wordsPerPage;
        }

        public void setWordsPerPage(int wordsPerPage) {
            this.wordsPerPage = wordsPerPage;
        }
    }
}
