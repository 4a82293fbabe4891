package uk.gegc.dolos.features.packaging.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable view of a word-processing package: part name (zip entry name, no leading slash) to raw bytes.
 * Every mutator returns a new instance; byte arrays are copied in and out.
 */
public final class DocxPackage {

    private final Map<String, byte[]> parts;

    private DocxPackage(Map<String, byte[]> parts) {
        this.parts = parts;
    }

    public static DocxPackage of(Map<String, byte[]> parts) {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        parts.forEach((name, bytes) -> copy.put(normalize(name), bytes.clone()));
        return new DocxPackage(Collections.unmodifiableMap(copy));
    }

    public boolean hasPart(String name) {
        return parts.containsKey(normalize(name));
    }

    public Optional<byte[]> part(String name) {
        byte[] bytes = parts.get(normalize(name));
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }

    public byte[] requirePart(String name) {
        return part(name).orElseThrow(() -> new MissingRequiredPartException("Package has no part " + name));
    }

    public Optional<String> partAsString(String name) {
        return part(name).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Part names in ascending order.
     */
    public Set<String> partNames() {
        return Collections.unmodifiableSet(new TreeSet<>(parts.keySet()));
    }

    public int size() {
        return parts.size();
    }

    public DocxPackage withPart(String name, byte[] bytes) {
        Map<String, byte[]> copy = new LinkedHashMap<>(parts);
        copy.put(normalize(name), bytes.clone());
        return new DocxPackage(Collections.unmodifiableMap(copy));
    }

    public DocxPackage withParts(Map<String, byte[]> replacements) {
        Map<String, byte[]> copy = new LinkedHashMap<>(parts);
        replacements.forEach((name, bytes) -> copy.put(normalize(name), bytes.clone()));
        return new DocxPackage(Collections.unmodifiableMap(copy));
    }

    static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Part name must not be blank");
        }
        return name.startsWith("/") ? name.substring(1) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocxPackage other) || !parts.keySet().equals(other.parts.keySet())) {
            return false;
        }
        for (Map.Entry<String, byte[]> entry : parts.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.parts.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, byte[]> entry : parts.entrySet()) {
            hash += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        return "DocxPackage" + partNames();
    }
}
