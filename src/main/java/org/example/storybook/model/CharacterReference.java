package org.example.storybook.model;

/**
 * Reference sheet for one character. Profile fields are copied in so the reference
 * stays meaningful after the profile list is regenerated.
 */
public class CharacterReference {

    private String characterName;
    private String prompt;
    private String imageUrl;
    private String species;
    private String physicalDescription;
    private String clothing;
    private String distinctiveFeatures;

    public CharacterReference() {
    }

    public CharacterReference(String characterName, String prompt) {
        this.characterName = characterName;
        this.prompt = prompt;
    }

    public static CharacterReference fromProfile(CharacterProfile profile, String prompt) {
        CharacterReference reference = new CharacterReference(profile.name(), prompt);
        reference.setSpecies(profile.species());
        reference.setPhysicalDescription(profile.physicalDescription());
        reference.setClothing(profile.clothing());
        reference.setDistinctiveFeatures(profile.distinctiveFeatures());
        return reference;
    }

    public String getCharacterName() {
        return characterName;
    }

    public void setCharacterName(String characterName) {
        this.characterName = characterName;
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

    public String getSpecies() {
        return species;
    }

    public void setSpecies(String species) {
        this.species = species;
    }

    public String getPhysicalDescription() {
        return physicalDescription;
    }

    public void setPhysicalDescription(String physicalDescription) {
        this.physicalDescription = physicalDescription;
    }

    public String getClothing() {
        return clothing;
    }

    public void setClothing(String clothing) {
        this.clothing = clothing;
    }

    public String getDistinctiveFeatures() {
        return distinctiveFeatures;
    }

    public void setDistinctiveFeatures(String distinctiveFeatures) {
        this.distinctiveFeatures = distinctiveFeatures;
    }
}
