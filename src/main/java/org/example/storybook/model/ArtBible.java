package org.example.storybook.model;

/**
 * Reference illustration and style descriptors that establish the visual style of one story.
 */
public class ArtBible {

    private String prompt;
    private String imageUrl;
    private String artStyle;
    private String styleNotes;
    private String colorPalette;
    private String lightingStyle;
    private String brushTechnique;

    public ArtBible() {
    }

    public ArtBible(String prompt, String artStyle, String colorPalette, String lightingStyle,
                    String brushTechnique, String styleNotes) {
        this.prompt = prompt;
        this.artStyle = artStyle;
        this.colorPalette = colorPalette;
        this.lightingStyle = lightingStyle;
        this.brushTechnique = brushTechnique;
        this.styleNotes = styleNotes;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getArtStyle() {
        return artStyle;
    }

    public void setArtStyle(String artStyle) {
        this.artStyle = artStyle;
    }

    public String getStyleNotes() {
        return styleNotes;
    }

    public void setStyleNotes(String styleNotes) {
        this.styleNotes = styleNotes;
    }

    public String getColorPalette() {
        return colorPalette;
    }

    public void setColorPalette(String colorPalette) {
        this.colorPalette = colorPalette;
    }

    public String getLightingStyle() {
        return lightingStyle;
    }

    public void setLightingStyle(String lightingStyle) {
        this.lightingStyle = lightingStyle;
    }

    public String getBrushTechnique() {
        return brushTechnique;
    }

    public void setBrushTechnique(String brushTechnique) {
        this.brushTechnique = brushTechnique;
    }
}
