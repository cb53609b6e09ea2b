package com.ryuqq.repoup.adapter.process;

import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.spi.MetadataComponent;
import com.ryuqq.repoup.core.spi.MetadataGenerator;
import com.ryuqq.repoup.core.spi.MetadataRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * 외부 인덱싱 도구를 호출하는 MetadataGenerator.
 *
 * <p>요청의 전체 패키지 집합을 임시 디렉터리에 저장소와 같은 상대 경로
 * ({@code packages/<file>})로 펼친 뒤 도구를 실행합니다. 결과 파일은 그대로 컴포넌트가 되고,
 * 키 이름과 매니페스트는 호출자가 만듭니다.</p>
 *
 * <ul>
 *   <li>RPM: {@code createrepo_c --simple-md-filenames} → {@code repodata/*} 파일마다 컴포넌트 하나
 *       ({@code primary.xml.gz} → name {@code primary}, extension {@code xml.gz})</li>
 *   <li>DEB: {@code dpkg-scanpackages --multiversion packages} → gzip된 {@code Packages} 컴포넌트</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class CommandMetadataGenerator implements MetadataGenerator {

    private static final Logger log = LoggerFactory.getLogger(CommandMetadataGenerator.class);

    private static final String PACKAGES_DIR = "packages";
    private static final String REPODATA_DIR = "repodata";

    private final ProcessRunner runner;
    private final MetadataToolConfig config;

    public CommandMetadataGenerator(MetadataToolConfig config) {
        this(new SystemProcessRunner(), config);
    }

    public CommandMetadataGenerator(ProcessRunner runner, MetadataToolConfig config) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.runner = runner;
        this.config = config;
    }

    @Override
    public List<MetadataComponent> generate(MetadataRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        try (WorkDirectory work = WorkDirectory.create("repoup-metadata-")) {
            for (IndexedPackage indexed : request.packages()) {
                work.write(PACKAGES_DIR + "/" + indexed.descriptor().artifactFilename(),
                    request.contentSource().read(indexed));
            }
            log.debug("Staged {} packages for {} metadata generation", request.packages().size(), request.prefix());
            return request.format() == PackageFormat.RPM ? createrepo(work) : scanPackages(work);
        } catch (UncheckedIOException e) {
            throw new MetadataBuildFailedException("Unable to prepare metadata generation: " + e.getMessage(), e);
        }
    }

    private List<MetadataComponent> createrepo(WorkDirectory work) {
        run(List.of(config.createrepoCommand(),
            "--simple-md-filenames",
            "--no-database",
            "--checksum", config.checksumType(),
            "--general-compress-type", config.compressionType(),
            "--outputdir", work.root().toString(),
            work.root().toString()
        ), work);

        List<MetadataComponent> components = new ArrayList<>();
        for (Path file : work.listFiles(REPODATA_DIR)) {
            String filename = file.getFileName().toString();
            int dot = filename.indexOf('.');
            if (dot <= 0 || dot == filename.length() - 1) {
                throw new MetadataBuildFailedException("Unexpected createrepo_c output file: " + filename);
            }
            components.add(new MetadataComponent(filename.substring(0, dot), filename.substring(dot + 1),
                work.read(REPODATA_DIR + "/" + filename)));
        }
        if (components.isEmpty()) {
            throw new MetadataBuildFailedException("createrepo_c produced no metadata");
        }
        return components;
    }

    private List<MetadataComponent> scanPackages(WorkDirectory work) {
        work.write(PACKAGES_DIR + "/.keep", new byte[0]);
        ProcessResult result = run(List.of(config.scanPackagesCommand(), "--multiversion", PACKAGES_DIR, "/dev/null"), work);
        return List.of(new MetadataComponent("Packages", "gz", gzip(result.stdout())));
    }

    private ProcessResult run(List<String> arguments, WorkDirectory work) {
        ProcessCommand command = ProcessCommand.of(config.timeout(), arguments).withWorkingDirectory(work.root());
        ProcessResult result;
        try {
            result = runner.run(command);
        } catch (UncheckedIOException e) {
            throw new MetadataBuildFailedException("Unable to run " + command.executable() + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new MetadataBuildFailedException(String.format("%s exited with %d: %s",
                command.executable(), result.exitCode(), result.stderrText()));
        }
        return result;
    }

    private static byte[] gzip(byte[] content) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }
}
