package net.littleredcomputer.cnfanalysis;

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Content digests identifying the file a report was computed from.
 */
final class SourceDigests {
    private SourceDigests() {}

    /**
     * @return attribute name to lowercase hex digest, for md5sum and sha1sum
     */
    @SuppressWarnings("deprecation")  // MD5 and SHA-1 identify files here; they protect nothing.
    static ImmutableMap<String, String> of(Path file) throws IOException {
        ByteSource source = MoreFiles.asByteSource(file);
        return ImmutableMap.of(
                "md5sum", source.hash(Hashing.md5()).toString(),
                "sha1sum", source.hash(Hashing.sha1()).toString());
    }
}
