package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.error.MalformedPackageException;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Debian descriptor extractor for the {@code name_version[-revision]_arch.deb} file name convention.
 *
 * <p>The control archive is not inspected.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class DebDescriptorExtractor implements PackageDescriptorExtractor {

    private static final Pattern NAME_VERSION_ARCH = Pattern.compile(
        "^(?<name>[a-z0-9][a-z0-9+.\\-]*)_(?<version>[^_]+)_(?<arch>[a-z0-9\\-]+)\\.deb$"
    );

    @Override
    public boolean supports(String filename) {
        return PackageFormat.DEB.matchesFilename(filename);
    }

    @Override
    public ExtractionResult extract(PackageArtifact artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        Matcher matcher = NAME_VERSION_ARCH.matcher(artifact.getFilename());
        if (!matcher.matches()) {
            throw new MalformedPackageException(String.format(
                "Unable to parse the \"%s\" package name. Expected \"<name>_<version>_<arch>.deb\".",
                artifact.getFilename()
            ));
        }
        String fullVersion = matcher.group("version");
        int dash = fullVersion.lastIndexOf('-');
        String version = dash > 0 ? fullVersion.substring(0, dash) : fullVersion;
        String revision = dash > 0 ? fullVersion.substring(dash + 1) : "";

        return ExtractionResult.of(new PackageDescriptor(
            matcher.group("name"),
            version,
            revision,
            matcher.group("arch"),
            null,
            PackageFormat.DEB,
            artifact.contentHash()
        ));
    }
}
