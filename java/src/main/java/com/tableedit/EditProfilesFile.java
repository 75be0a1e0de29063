package com.tableedit;

import java.util.HashMap;
import java.util.Map;

public class EditProfilesFile {
    private Map<String, EditProfile> profiles = new HashMap<>();

    public EditProfilesFile() {
    }

    public Map<String, EditProfile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, EditProfile> profiles) {
        this.profiles = profiles != null ? profiles : new HashMap<>();
    }

    /**
     * The named profile, or a profile with all defaults if {@code name} is {@code null}.
     */
    public EditProfile profile(String name) {
        if (name == null) {
            return profiles.getOrDefault("default", new EditProfile());
        }
        EditProfile profile = profiles.get(name);
        if (profile == null) {
            throw new IllegalArgumentException("No profile named " + name + "; known: " + profiles.keySet());
        }
        return profile;
    }
}
