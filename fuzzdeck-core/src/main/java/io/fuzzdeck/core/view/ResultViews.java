package io.fuzzdeck.core.view;

import io.fuzzdeck.api.result.PartitionedResults;
import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.result.ResultSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only projections of a published snapshot. Cheap enough to run on every render.
 */
public final class ResultViews {

    private static final Logger log = LoggerFactory.getLogger(ResultViews.class);

    private ResultViews() {}

    /**
     * Split a snapshot by outcome, keeping snapshot order on both sides.
     */
    public static PartitionedResults partition(ResultSnapshot snapshot) {
        List<ResultRecord> succeeded = new ArrayList<>();
        List<ResultRecord> failed = new ArrayList<>();
        for (ResultRecord record : snapshot.records()) {
            if (record.ok()) {
                succeeded.add(record);
            } else {
                failed.add(record);
            }
        }
        return new PartitionedResults(succeeded, failed);
    }

    /**
     * Keep the records whose decoded response contains {@code substring} (case-sensitive).
     * Records whose response cannot be decoded never match.
     *
     * @return the snapshot itself when {@code substring} is empty
     */
    public static ResultSnapshot search(ResultSnapshot snapshot, String substring) {
        if (substring == null || substring.isEmpty()) {
            return snapshot;
        }
        List<ResultRecord> matches = new ArrayList<>();
        for (ResultRecord record : snapshot.records()) {
            Optional<String> text = decodeResponse(record);
            if (text.isPresent() && text.get().contains(substring)) {
                matches.add(record);
            }
        }
        return new ResultSnapshot(snapshot.token(), matches, snapshot.publishedAt());
    }

    /**
     * Decode the response under the engine's encoding hint, falling back to UTF-8
     * when the hint is missing or unknown.
     *
     * @return empty if the bytes are not valid in that encoding
     */
    public static Optional<String> decodeResponse(ResultRecord record) {
        Charset charset = charsetFor(record.responseEncoding());
        try {
            return Optional.of(charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(record.responseBytes()))
                    .toString());
        } catch (CharacterCodingException e) {
            log.debug("Response of {} is not valid {}", record.uuid(), charset.name());
            return Optional.empty();
        }
    }

    static Charset charsetFor(String hint) {
        if (hint == null || hint.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(hint.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }
}
