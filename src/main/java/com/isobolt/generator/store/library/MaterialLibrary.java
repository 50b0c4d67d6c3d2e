package com.isobolt.generator.store.library;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.isobolt.generator.codegen.util.FileWriteUtil;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.store.ArtifactStore;
import com.isobolt.generator.store.BumpPatternEdit;
import com.isobolt.generator.store.StoreOperationException;
import com.isobolt.generator.store.TransactionScope;

/**
 * Material store backed by a JSON library file.
 *
 * Materials are kept in memory in file order. Mutations are only allowed inside
 * {@link #run(String, Supplier)}; a commit writes the library back to its file, a failure
 * restores the state seen when the transaction began.
 */
public class MaterialLibrary implements ArtifactStore, TransactionScope {

    private static final Logger log = LoggerFactory.getLogger(MaterialLibrary.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final MaterialLibraryCodec CODEC = new MaterialLibraryCodec(MAPPER);

    private final String title;
    private final Path path;
    private Map<String, Material> materials = new LinkedHashMap<>();

    private String activeTransaction;
    private Map<String, Material> snapshot;

    private MaterialLibrary(String title, Path path) {
        this.title = title;
        this.path = path;
    }

    /**
     * Creates an empty library that is never written to disk.
     */
    public static MaterialLibrary inMemory(String title) {
        return new MaterialLibrary(title, null);
    }

    /**
     * Loads a library file. The file name without extension serves as title when the file
     * declares none.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws MaterialLibraryFormatException if the JSON does not describe a library
     */
    public static MaterialLibrary open(Path path) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            throw new IOException("Material library " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MaterialLibraryFormatException("Material library " + path + " must contain a JSON object");
        }
        String fileName = path.getFileName().toString();
        String fallback = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;

        MaterialLibrary library = new MaterialLibrary(CODEC.readTitle(root, fallback), path);
        for (Material material : CODEC.readMaterials(root, library.title)) {
            library.put(material);
        }
        log.debug("Loaded {} material(s) from {}", library.materials.size(), path);
        return library;
    }

    /**
     * Adds a material as if it had been authored in this library. Intended for setting up
     * libraries programmatically.
     */
    public MaterialLibrary add(Material material) {
        put(material.toBuilder().documentId(title).build());
        return this;
    }

    public List<Material> getMaterials() {
        return new ArrayList<>(materials.values());
    }

    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    public boolean isInTransaction() {
        return activeTransaction != null;
    }

    /**
     * Writes the library to its file. In-memory libraries ignore the call.
     */
    public void save() throws IOException {
        if (path == null) {
            return;
        }
        String json = MAPPER.writeValueAsString(CODEC.writeLibrary(title, materials.values()));
        FileWriteUtil.replaceString(path, json + System.lineSeparator());
        log.debug("Saved {} material(s) to {}", materials.size(), path);
    }

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public List<Material> find(Pattern namePattern) {
        return materials.values().stream()
                .filter(m -> namePattern.matcher(m.getName()).matches())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Material> findByName(String name) {
        return Optional.ofNullable(materials.get(name));
    }

    @Override
    public Material create(Material template, String name, BumpPatternEdit edit) {
        requireTransaction("create \"" + name + "\"");
        if (template == null) {
            throw new StoreOperationException("Cannot create \"" + name + "\" from a null template");
        }
        if (!materials.containsKey(template.getName())) {
            throw new StoreOperationException("Template \"" + template.getName() + "\" does not reside in " + title);
        }
        if (materials.containsKey(name)) {
            throw new StoreOperationException("Material \"" + name + "\" already exists in " + title);
        }
        Material created = edit.applyTo(template, name).toBuilder().documentId(title).build();
        materials.put(name, created);
        return created;
    }

    @Override
    public void delete(Material material) {
        String name = material != null ? material.getName() : null;
        requireTransaction("delete \"" + name + "\"");
        if (name == null || materials.remove(name) == null) {
            throw new StoreOperationException("Material \"" + name + "\" does not exist in " + title);
        }
    }

    @Override
    public <T> T run(String name, Supplier<T> body) {
        if (activeTransaction != null) {
            throw new IllegalStateException(
                    "Cannot start \"" + name + "\" while \"" + activeTransaction + "\" is in progress");
        }
        log.debug("Starting transaction \"{}\"", name);
        activeTransaction = name;
        snapshot = new LinkedHashMap<>(materials);
        try {
            T result = body.get();
            commit(name);
            return result;
        } catch (RuntimeException e) {
            materials = snapshot;
            log.warn("Rolled back transaction \"{}\"", name);
            throw e;
        } finally {
            activeTransaction = null;
            snapshot = null;
        }
    }

    private void commit(String name) {
        try {
            save();
        } catch (IOException e) {
            throw new StoreOperationException("Cannot commit transaction \"" + name + "\" to " + path, e);
        }
        log.debug("Committed transaction \"{}\"", name);
    }

    private void put(Material material) {
        if (materials.putIfAbsent(material.getName(), material) != null) {
            throw new MaterialLibraryFormatException("Duplicate material \"" + material.getName() + "\" in " + title);
        }
    }

    private void requireTransaction(String operation) {
        if (activeTransaction == null) {
            throw new IllegalStateException("Cannot " + operation + " outside of a transaction");
        }
    }
}
