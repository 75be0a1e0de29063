package com.tableedit;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class EditProfileLoader {
    public static EditProfilesFile load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static EditProfilesFile load(InputStream in) {
        Constructor constructor = new Constructor(EditProfilesFile.class, new LoaderOptions());
        TypeDescription file = new TypeDescription(EditProfilesFile.class);
        file.addPropertyParameters("profiles", String.class, EditProfile.class);
        constructor.addTypeDescription(file);
        Yaml yaml = new Yaml(constructor);
        EditProfilesFile loaded = yaml.load(in);
        return loaded != null ? loaded : new EditProfilesFile();
    }
}
