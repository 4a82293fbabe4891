package uk.gegc.dolos.features.packaging.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.domain.MissingRequiredPartException;
import uk.gegc.dolos.features.packaging.domain.NotAPackageException;
import uk.gegc.dolos.features.packaging.domain.PartNames;
import uk.gegc.dolos.features.packaging.infra.PackageRelationships;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Unpacks a package into addressable parts and repacks it deterministically:
 * {@code [Content_Types].xml} first, {@code _rels/.rels} second, then every other part by name,
 * each entry stamped with the same DOS timestamp.
 */
@Component
@Slf4j
public class PackageIo {

    static final LocalDateTime ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private static final Comparator<String> PART_ORDER = Comparator
            .comparingInt(PackageIo::rank)
            .thenComparing(Comparator.naturalOrder());

    /**
     * @throws NotAPackageException         when the bytes are not a zip container
     * @throws MissingRequiredPartException when the body or core-properties part is absent
     */
    public DocxPackage unpack(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new NotAPackageException("Input is empty");
        }

        Map<String, byte[]> parts = new LinkedHashMap<>();
        try (ZipInputStream zipIn = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zipIn.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    zipIn.closeEntry();
                    continue;
                }
                if (parts.containsKey(entry.getName())) {
                    log.warn("Duplicate zip entry {} ignored", entry.getName());
                    zipIn.closeEntry();
                    continue;
                }
                parts.put(entry.getName(), zipIn.readAllBytes());
                zipIn.closeEntry();
            }
        } catch (ZipException e) {
            throw new NotAPackageException("Input is not a valid zip container: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new NotAPackageException("Failed to read package: " + e.getMessage(), e);
        }

        if (parts.isEmpty() || !parts.containsKey(PartNames.CONTENT_TYPES)) {
            throw new NotAPackageException("Input is not a word-processing package");
        }

        DocxPackage pkg = DocxPackage.of(parts);
        requirePart(pkg, PackageRelationships.mainDocument(pkg), "document body");
        requirePart(pkg, PackageRelationships.coreProperties(pkg), "core properties");
        log.debug("Unpacked {} parts", pkg.size());
        return pkg;
    }

    public byte[] repack(DocxPackage pkg) {
        List<String> names = new ArrayList<>(pkg.partNames());
        names.sort(PART_ORDER);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zipOut = new ZipOutputStream(out)) {
            zipOut.setMethod(ZipOutputStream.DEFLATED);
            for (String name : names) {
                ZipEntry entry = new ZipEntry(name);
                entry.setTimeLocal(ENTRY_TIME);
                zipOut.putNextEntry(entry);
                zipOut.write(pkg.requirePart(name));
                zipOut.closeEntry();
            }
        } catch (IOException e) {
            // in-memory streams only fail on programming errors
            throw new UncheckedIOException("Failed to write package", e);
        }
        return out.toByteArray();
    }

    /**
     * Unpacks, applies the transform, and repacks. The input bytes are never modified.
     */
    public byte[] transform(byte[] bytes, UnaryOperator<DocxPackage> transform) {
        return repack(transform.apply(unpack(bytes)));
    }

    private static void requirePart(DocxPackage pkg, String partName, String description) {
        if (!pkg.hasPart(partName)) {
            throw new MissingRequiredPartException("Package is missing its " + description + " part (" + partName + ")");
        }
    }

    private static int rank(String name) {
        if (PartNames.CONTENT_TYPES.equals(name)) {
            return 0;
        }
        if (PartNames.ROOT_RELATIONSHIPS.equals(name)) {
            return 1;
        }
        return 2;
    }
}
