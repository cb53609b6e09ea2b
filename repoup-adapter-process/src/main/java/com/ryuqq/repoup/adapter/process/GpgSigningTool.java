package com.ryuqq.repoup.adapter.process;

import com.ryuqq.repoup.core.error.SigningFailedException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.spi.KeyReference;
import com.ryuqq.repoup.core.spi.SigningSession;
import com.ryuqq.repoup.core.spi.SigningTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * GnuPG + rpm 기반 SigningTool.
 *
 * <p>세션마다 전용 GNUPGHOME을 만들어 키를 import하고, 세션이 닫히면 키와 디렉터리를 제거합니다.</p>
 *
 * <ul>
 *   <li>패키지 서명: {@code rpm --addsign}, 검증: {@code rpm --checksig}</li>
 *   <li>매니페스트 서명: {@code gpg --detach-sign --armor}, 검증: {@code gpg --verify}</li>
 *   <li>passphrase가 있으면 {@code gpg-preset-passphrase}로 에이전트에 미리 등록</li>
 *   <li>{@code rpm --checksig}를 위해 공개 키를 rpm 키링에 import ({@code verifyRequiresElevation}이면 sudo)</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class GpgSigningTool implements SigningTool {

    private static final Logger log = LoggerFactory.getLogger(GpgSigningTool.class);

    private static final String WORK_DIR = "work";

    private final ProcessRunner runner;
    private final GpgToolConfig config;

    public GpgSigningTool(GpgToolConfig config) {
        this(new SystemProcessRunner(), config);
    }

    public GpgSigningTool(ProcessRunner runner, GpgToolConfig config) {
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
    public SigningSession openSession(KeyReference key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        WorkDirectory home;
        try {
            home = WorkDirectory.create("repoup-gnupg-");
            home.write("gpg-agent.conf", "allow-preset-passphrase\n".getBytes(StandardCharsets.UTF_8));
        } catch (UncheckedIOException e) {
            throw new SigningFailedException("Unable to prepare GnuPG home: " + e.getMessage(), e);
        }
        GpgSession session = new GpgSession(home);
        try {
            session.importKey(key);
            return session;
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }

    public GpgToolConfig getConfig() {
        return config;
    }

    /**
     * 전용 GNUPGHOME 하나에 묶인 세션.
     */
    private final class GpgSession implements SigningSession {

        private final WorkDirectory home;
        private GpgKeyInfo keyInfo;
        private boolean rpmKeyImported;
        private int sequence;

        private GpgSession(WorkDirectory home) {
            this.home = home;
        }

        void importKey(KeyReference key) {
            // 1. 키 정보 (import 없이)
            ProcessResult shown = checked("inspect signing key", gpg(
                "--with-colons", "--with-keygrip", "--import-options", "show-only", "--import", key.keyLocation()));
            keyInfo = GpgKeyInfo.parse(shown.stdoutText());

            // 2. passphrase preset
            if (key.hasPassphrase()) {
                checked("preset key passphrase", command(List.of(config.presetPassphraseCommand(), "--preset",
                    keyInfo.keygrip())).withInput((key.passphrase() + "\n").getBytes(StandardCharsets.UTF_8)));
            }

            // 3. import
            checked("import signing key", gpg("--import", key.keyLocation()));
            log.info("Imported signing key {} ({})", keyInfo.fingerprint(), keyInfo.userId());
        }

        @Override
        public byte[] signPackage(String filename, byte[] content) {
            String relative = workFile(filename);
            home.write(relative, content);
            checked("sign package " + filename, command(List.of(config.rpmCommand(), "--addsign",
                "--define", "_gpg_name " + keyInfo.fingerprint(),
                "--define", "_gpg_path " + home.root(),
                home.resolve(relative).toString())));
            return readFile(relative);
        }

        @Override
        public byte[] signDetached(byte[] content) {
            String payload = workFile("payload-" + (++sequence));
            String signature = payload + ".asc";
            home.write(payload, content);
            checked("sign manifest", gpg("--local-user", keyInfo.fingerprint(), "--detach-sign", "--armor",
                "--output", home.resolve(signature).toString(), home.resolve(payload).toString()));
            return readFile(signature);
        }

        @Override
        public boolean verifyPackage(String filename, byte[] content) {
            importRpmKey();
            String relative = workFile(filename);
            home.write(relative, content);
            ProcessResult result = run("verify package " + filename,
                command(List.of(config.rpmCommand(), "--checksig", home.resolve(relative).toString())));
            // 서명이 없는 패키지도 "digests OK"로 0을 반환하므로 signatures 항목을 함께 확인
            boolean valid = result.isSuccess() && result.stdoutText().contains("signatures OK");
            if (!valid) {
                log.warn("rpm --checksig rejected {}: {} {}", filename, result.stdoutText().trim(), result.stderrText());
            }
            return valid;
        }

        @Override
        public boolean verifyDetached(byte[] content, byte[] signature) {
            String payload = workFile("verify-" + (++sequence));
            home.write(payload, content);
            home.write(payload + ".asc", signature);
            ProcessResult result = run("verify manifest signature", gpg("--verify",
                home.resolve(payload + ".asc").toString(), home.resolve(payload).toString()));
            if (!result.isSuccess()) {
                log.warn("gpg --verify rejected the signature: {}", result.stderrText());
            }
            return result.isSuccess();
        }

        private void importRpmKey() {
            if (rpmKeyImported) {
                return;
            }
            ProcessResult exported = checked("export public key", gpg("--armor", "--export", keyInfo.fingerprint()));
            String publicKey = workFile("public.asc");
            home.write(publicKey, exported.stdout());
            checked("import public key into rpm", elevated(List.of(config.rpmCommand(), "--import",
                home.resolve(publicKey).toString())));
            rpmKeyImported = true;
        }

        @Override
        public void close() {
            if (keyInfo != null && config.clearKeyAfterUse()) {
                if (rpmKeyImported) {
                    quietly("remove public key from rpm", this::eraseRpmKey);
                }
                quietly("delete secret key", () -> checked("delete secret key",
                    gpg("--delete-secret-keys", keyInfo.fingerprint())));
                quietly("delete public key", () -> checked("delete public key",
                    gpg("--delete-keys", keyInfo.fingerprint())));
            }
            quietly("stop gpg-agent", () -> run("stop gpg-agent",
                command(List.of(config.gpgconfCommand(), "--kill", "gpg-agent"))));
            home.close();
            log.debug("Signing session closed");
        }

        private void eraseRpmKey() {
            ProcessResult installed = checked("list rpm keys", command(List.of(config.rpmCommand(), "-q", "gpg-pubkey",
                "--qf", "%{NAME}-%{VERSION}-%{RELEASE}\\t%{SUMMARY}\\n")));
            String expected = keyInfo.userId() + " ";
            for (String line : installed.stdoutText().split("\\R")) {
                int tab = line.indexOf('\t');
                if (tab > 0 && line.substring(tab + 1).startsWith(expected)) {
                    checked("erase rpm key", elevated(List.of(config.rpmCommand(), "--erase", "--allmatches",
                        line.substring(0, tab))));
                    return;
                }
            }
            log.debug("Public key {} is no longer in the rpm keyring", keyInfo.fingerprint());
        }

        private String workFile(String filename) {
            if (filename == null || filename.isBlank() || filename.contains("/") || filename.contains("\\")) {
                throw new SigningFailedException("Invalid file name for signing: " + filename);
            }
            return WORK_DIR + "/" + filename;
        }

        private byte[] readFile(String relative) {
            try {
                return home.read(relative);
            } catch (UncheckedIOException e) {
                throw new SigningFailedException("Signing tool produced no output: " + e.getMessage(), e);
            }
        }

        private ProcessCommand gpg(String... arguments) {
            List<String> command = new ArrayList<>();
            command.add(config.gpgCommand());
            command.add("--batch");
            command.add("--yes");
            command.addAll(List.of(arguments));
            return command(command);
        }

        private ProcessCommand elevated(List<String> arguments) {
            if (!config.verifyRequiresElevation()) {
                return command(arguments);
            }
            List<String> command = new ArrayList<>();
            command.add("sudo");
            command.add("-n");
            command.addAll(arguments);
            return command(command);
        }

        private ProcessCommand command(List<String> arguments) {
            return ProcessCommand.of(config.timeout(), arguments)
                .withWorkingDirectory(home.root())
                .withEnvironment("GNUPGHOME", home.root().toString());
        }

        private ProcessResult checked(String operation, ProcessCommand command) {
            ProcessResult result = run(operation, command);
            if (!result.isSuccess()) {
                throw new SigningFailedException(String.format("Failed to %s: %s exited with %d: %s",
                    operation, command.executable(), result.exitCode(), result.stderrText()));
            }
            return result;
        }

        private ProcessResult run(String operation, ProcessCommand command) {
            try {
                return runner.run(command);
            } catch (UncheckedIOException e) {
                throw new SigningFailedException("Failed to " + operation + ": " + e.getMessage(), e);
            }
        }

        private void quietly(String operation, Runnable cleanup) {
            try {
                cleanup.run();
            } catch (SigningFailedException | UpdateTimeoutException e) {
                log.warn("Signing session cleanup step '{}' failed: {}", operation, e.getMessage());
            }
        }
    }
}
