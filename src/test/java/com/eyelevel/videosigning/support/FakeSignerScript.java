package com.eyelevel.videosigning.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Writes a shell script that accepts the signer's command line. Its behaviour depends on the input:
 * content containing {@code SLEEP} hangs for 30 seconds, content containing {@code FAIL} exits with
 * code 3, and anything else is written to the output prefixed with {@code SIGNED:}.
 */
public final class FakeSignerScript {

    public static final String SIGNED_PREFIX = "SIGNED:";
    public static final int FAILURE_EXIT_CODE = 3;

    private static final String SCRIPT = """
            #!/bin/sh
            in=""
            out=""
            while [ $# -gt 0 ]; do
              case "$1" in
                --input) in="$2"; shift 2 ;;
                --output) out="$2"; shift 2 ;;
                --key|--key-password) shift 2 ;;
                --help) echo "usage: signer --input IN --output OUT --key KEY"; exit 0 ;;
                *) shift ;;
              esac
            done
            if grep -q SLEEP "$in"; then
              sleep 30
            fi
            if grep -q FAIL "$in"; then
              echo "could not load key material" >&2
              exit 3
            fi
            echo "signing $in"
            { printf 'SIGNED:'; cat "$in"; } > "$out"
            """;

    private FakeSignerScript() {
    }

    public static Path write(final Path directory) throws IOException {
        final Path script = directory.resolve("fake-signer.sh");
        Files.writeString(script, SCRIPT);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }
}
