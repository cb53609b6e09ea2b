package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.error.MalformedPackageException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RPM descriptor extractor.
 *
 * <p>Parses the {@code name-[epoch:]version-release.arch.rpm} file name convention and, when the
 * artifact starts with an RPM lead, the main header. Header values win; each disagreeing field is
 * reported as a {@link DescriptorMismatch}.</p>
 *
 * <p>The OS tag is taken from the dist tag of the release ({@code 1.el8} gives {@code el8}).</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RpmDescriptorExtractor implements PackageDescriptorExtractor {

    private static final Pattern NEVRA = Pattern.compile(
        "^(?<name>.+)-((?<epoch>\\d+):)?(?<version>[^-]+)-(?<release>[^-]+)\\.(?<arch>[^.]+)\\.rpm$",
        Pattern.CASE_INSENSITIVE
    );

    private final boolean requireHeader;

    /**
     * 헤더가 없는 아티팩트는 파일 이름만으로 처리하는 기본 extractor.
     */
    public RpmDescriptorExtractor() {
        this(false);
    }

    /**
     * @param requireHeader true이면 RPM lead가 없는 아티팩트를 MalformedPackage로 거부
     */
    public RpmDescriptorExtractor(boolean requireHeader) {
        this.requireHeader = requireHeader;
    }

    @Override
    public boolean supports(String filename) {
        return PackageFormat.RPM.matchesFilename(filename);
    }

    @Override
    public ExtractionResult extract(PackageArtifact artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        String filename = artifact.getFilename();
        Nevra fromName = parseFilename(filename);
        byte[] content = artifact.getContent();
        ContentHash hash = artifact.contentHash();

        if (!RpmHeaderReader.hasLead(content)) {
            if (requireHeader) {
                throw new MalformedPackageException("Not an RPM package (missing lead): " + filename);
            }
            if (fromName == null) {
                throw new MalformedPackageException(invalidNameMessage(filename));
            }
            return ExtractionResult.of(fromName.toDescriptor(hash));
        }

        RpmHeaderReader.RpmHeader header = RpmHeaderReader.read(content);
        Nevra fromHeader = new Nevra(
            header.name(),
            header.epoch() == null || header.epoch() == 0 ? null : String.valueOf(header.epoch()),
            header.version(),
            header.release(),
            header.arch()
        );
        List<DescriptorMismatch> mismatches = new ArrayList<>();
        if (fromName != null) {
            compare("name", fromHeader.name(), fromName.name(), mismatches);
            compare("epoch", fromHeader.epoch(), fromName.epoch(), mismatches);
            compare("version", fromHeader.version(), fromName.version(), mismatches);
            compare("release", fromHeader.release(), fromName.release(), mismatches);
            compare("architecture", fromHeader.arch(), fromName.arch(), mismatches);
        } else {
            mismatches.add(new DescriptorMismatch("filename", fromHeader.canonicalFilename(), filename));
        }
        return new ExtractionResult(fromHeader.toDescriptor(hash), mismatches);
    }

    private static void compare(String field, String header, String filename, List<DescriptorMismatch> mismatches) {
        if (!Objects.equals(header, filename)) {
            mismatches.add(new DescriptorMismatch(field, header, filename));
        }
    }

    private static Nevra parseFilename(String filename) {
        Matcher matcher = NEVRA.matcher(filename);
        if (!matcher.matches()) {
            return null;
        }
        return new Nevra(
            matcher.group("name"),
            matcher.group("epoch"),
            matcher.group("version"),
            matcher.group("release"),
            matcher.group("arch")
        );
    }

    private static String invalidNameMessage(String filename) {
        return String.format(
            "Unable to parse the \"%s\" package name. The package name must follow the RPM naming convention "
                + "\"<name>-<version>-<release>.<arch>.rpm\" (For instance: \"my_package-1.0.0-1.el8.noarch.rpm\").",
            filename
        );
    }

    /**
     * 배포판 태그 추출 ("1.el8" → "el8", "3" → null).
     */
    static String distTag(String release) {
        int dot = release.indexOf('.');
        if (dot < 0 || dot == release.length() - 1) {
            return null;
        }
        return release.substring(dot + 1);
    }

    private record Nevra(String name, String epoch, String version, String release, String arch) {

        PackageDescriptor toDescriptor(ContentHash hash) {
            String fullVersion = epoch == null ? version : epoch + ":" + version;
            return new PackageDescriptor(name, fullVersion, release, arch, distTag(release), PackageFormat.RPM, hash);
        }

        String canonicalFilename() {
            return name + "-" + version + "-" + release + "." + arch + ".rpm";
        }
    }
}
