package uk.gegc.dolos.features.packaging.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.dolos.BaseUnitTest;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.domain.MissingRequiredPartException;
import uk.gegc.dolos.features.packaging.domain.NotAPackageException;
import uk.gegc.dolos.testsupport.TestPackages;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PackageIo")
class PackageIoTest extends BaseUnitTest {

    private final PackageIo packageIo = new PackageIo();

    @Test
    @DisplayName("unpack(repack(p)) gives back the same parts")
    void repack_thenUnpack_sameParts() {
        DocxPackage pkg = TestPackages.builder().build();

        DocxPackage roundTripped = packageIo.unpack(packageIo.repack(pkg));

        assertThat(roundTripped).isEqualTo(pkg);
        assertThat(roundTripped.partNames()).containsExactlyElementsOf(pkg.partNames());
    }

    @Test
    @DisplayName("repack is byte-for-byte deterministic")
    void repack_twice_identicalBytes() {
        DocxPackage pkg = TestPackages.builder().build();

        assertThat(packageIo.repack(pkg)).isEqualTo(packageIo.repack(pkg));
    }

    @Test
    @DisplayName("repack writes content types, then root relationships, then the rest sorted, all with the fixed time")
    void repack_entryOrderAndTime() throws IOException {
        DocxPackage pkg = TestPackages.builder().build();

        List<String> names = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(packageIo.repack(pkg)))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                names.add(entry.getName());
                assertThat(entry.getTimeLocal()).isEqualTo(PackageIo.ENTRY_TIME);
            }
        }

        assertThat(names).containsExactly(
                "[Content_Types].xml",
                "_rels/.rels",
                "docProps/app.xml",
                "docProps/core.xml",
                "word/_rels/document.xml.rels",
                "word/document.xml",
                "word/settings.xml");
    }

    @Test
    @DisplayName("unpack rejects empty input")
    void unpack_empty_throws() {
        assertThatThrownBy(() -> packageIo.unpack(new byte[0]))
                .isInstanceOf(NotAPackageException.class);
    }

    @Test
    @DisplayName("unpack rejects bytes that are not a zip container")
    void unpack_notZip_throws() {
        byte[] text = "this is plainly not a zip archive".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> packageIo.unpack(text))
                .isInstanceOf(NotAPackageException.class);
    }

    @Test
    @DisplayName("unpack rejects a zip without a content-types part")
    void unpack_zipWithoutContentTypes_throws() throws IOException {
        byte[] zip = zip(Map.of("hello.txt", "hi"));

        assertThatThrownBy(() -> packageIo.unpack(zip))
                .isInstanceOf(NotAPackageException.class);
    }

    @Test
    @DisplayName("unpack reports a missing body part")
    void unpack_missingBody_throws() throws IOException {
        DocxPackage pkg = TestPackages.builder().build();
        Map<String, String> parts = new LinkedHashMap<>();
        for (String name : pkg.partNames()) {
            if (!name.equals("word/document.xml")) {
                parts.put(name, pkg.partAsString(name).orElseThrow());
            }
        }

        assertThatThrownBy(() -> packageIo.unpack(zip(parts)))
                .isInstanceOf(MissingRequiredPartException.class)
                .hasMessageContaining("word/document.xml");
    }

    @Test
    @DisplayName("unpack reports a missing core-properties part")
    void unpack_missingCore_throws() throws IOException {
        DocxPackage pkg = TestPackages.builder().build();
        Map<String, String> parts = new LinkedHashMap<>();
        for (String name : pkg.partNames()) {
            if (!name.equals("docProps/core.xml")) {
                parts.put(name, pkg.partAsString(name).orElseThrow());
            }
        }

        assertThatThrownBy(() -> packageIo.unpack(zip(parts)))
                .isInstanceOf(MissingRequiredPartException.class)
                .hasMessageContaining("core properties");
    }

    @Test
    @DisplayName("transform leaves the input bytes untouched")
    void transform_doesNotModifyInput() {
        byte[] input = packageIo.repack(TestPackages.builder().build());
        byte[] copy = input.clone();

        byte[] output = packageIo.transform(input,
                pkg -> pkg.withPart("word/document.xml", "<w:document/>".getBytes(StandardCharsets.UTF_8)));

        assertThat(input).isEqualTo(copy);
        assertThat(packageIo.unpack(output).partAsString("word/document.xml")).contains("<w:document/>");
    }

    private static byte[] zip(Map<String, String> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }
}
