package com.github.stormino.clipper.service.fetch;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.model.StreamSelector;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for yt-dlp command-line arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpCommandBuilder {

    /**
     * Output basename of a fetched source; the extension is chosen by yt-dlp.
     */
    public static final String SOURCE_BASENAME = "source";

    private final ClipperProperties properties;

    /**
     * Build the command downloading one stream selection into a directory.
     *
     * @param url Source URL
     * @param selector Resolved stream selector
     * @param targetDirectory Directory to write {@value #SOURCE_BASENAME}.&lt;ext&gt; into
     * @return yt-dlp command arguments
     */
    public List<String> buildDownloadCommand(@NonNull String url, @NonNull StreamSelector selector,
                                             @NonNull Path targetDirectory) {
        List<String> command = baseCommand();
        command.add("--newline");
        command.add("--no-part");
        command.add("--no-mtime");
        command.add("-f");
        command.add(selector.toFormatExpression());
        command.add("--merge-output-format");
        command.add("mp4");
        command.add("-o");
        command.add(targetDirectory.resolve(SOURCE_BASENAME + ".%(ext)s").toString());
        // Everything after "--" is a URL, never an option
        command.add("--");
        command.add(url);

        log.debug("Built download command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build the command printing source metadata as one JSON document.
     */
    public List<String> buildProbeCommand(@NonNull String url) {
        List<String> command = baseCommand();
        command.add("--skip-download");
        command.add("--dump-single-json");
        command.add("--");
        command.add(url);

        log.debug("Built probe command: {}", String.join(" ", command));
        return command;
    }

    private List<String> baseCommand() {
        ClipperProperties.Tools tools = properties.getTools();

        List<String> command = new ArrayList<>();
        command.add(tools.getYtDlpPath());
        command.add("--no-playlist");
        command.add("--no-colors");
        command.add("--no-warnings");
        if (tools.isForceIpv4()) {
            command.add("--force-ipv4");
        }

        String cookieFile = tools.getCookieFile();
        if (cookieFile != null && !cookieFile.isBlank()) {
            Path cookies = Paths.get(cookieFile);
            if (Files.isRegularFile(cookies)) {
                command.add("--cookies");
                command.add(cookies.toString());
            } else {
                log.warn("Configured cookie file {} does not exist, fetching without cookies", cookieFile);
            }
        }
        return command;
    }
}
