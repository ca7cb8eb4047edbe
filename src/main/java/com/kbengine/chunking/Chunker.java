package com.kbengine.chunking;

import java.util.ArrayList;
import java.util.List;

import com.kbengine.error.ValidationException;

/**
 * Splits text into character windows of at most {@code maxChunkSize}. Consecutive chunks
 * share exactly {@code overlap} characters: chunk {@code n+1} starts {@code overlap}
 * characters before chunk {@code n} ends, so dropping the first {@code overlap} characters
 * of every chunk but the first gives back the original text.
 *
 * <p>A window ends on the latest paragraph break inside the lookback range, else the latest
 * line break, else the latest sentence end. Without any of those it is cut hard at
 * {@code maxChunkSize}.
 *
 * <p>Whitespace at the end of the text is not emitted. Whitespace inside the text stays in
 * the chain, even when a run longer than a window yields a whitespace-only chunk.
 */
public class Chunker {
    static final int CHARS_PER_TOKEN = 4;

    private final int maxChunkSize;
    private final int overlap;
    private final int lookback;

    public Chunker(int maxChunkSize, int overlap) {
        this(maxChunkSize, overlap, Math.max(1, maxChunkSize / 4));
    }

    public Chunker(int maxChunkSize, int overlap, int lookback) {
        if (maxChunkSize <= 0) {
            throw new ValidationException("maxChunkSize must be > 0, got " + maxChunkSize);
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new ValidationException("overlap must be >= 0 and < maxChunkSize, got " + overlap);
        }
        if (lookback < 0) {
            throw new ValidationException("lookback must be >= 0, got " + lookback);
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
        this.lookback = lookback;
    }

    public List<Chunk> split(String documentId, String text) {
        List<Chunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int length = text.length();
        int contentEnd = length;
        while (contentEnd > 0 && Character.isWhitespace(text.charAt(contentEnd - 1))) {
            contentEnd--;
        }
        int start = 0;
        while (start < contentEnd) {
            int end = length - start <= maxChunkSize ? length : boundary(text, start);
            String window = text.substring(start, end);
            int index = chunks.size();
            chunks.add(new Chunk(
                    Chunk.chunkId(documentId, index),
                    documentId,
                    index,
                    window,
                    estimateTokens(window),
                    Checksums.sha256(window),
                    start,
                    end));
            if (end == length) {
                break;
            }
            start = end - overlap;
        }
        return chunks;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public int overlap() {
        return overlap;
    }

    static int estimateTokens(String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private int boundary(String text, int start) {
        int hardEnd = start + maxChunkSize;
        // the next window must start after this one, so a break has to leave more than overlap chars
        int floor = Math.max(start + overlap + 1, hardEnd - lookback);
        if (floor > hardEnd) {
            return hardEnd;
        }

        int paragraph = lastBreakAfter(text, "\n\n", floor, hardEnd);
        if (paragraph > 0) {
            return paragraph;
        }
        int line = lastBreakAfter(text, "\n", floor, hardEnd);
        if (line > 0) {
            return line;
        }
        int sentence = lastSentenceEnd(text, floor, hardEnd);
        if (sentence > 0) {
            return sentence;
        }
        return hardEnd;
    }

    private static int lastBreakAfter(String text, String separator, int floor, int hardEnd) {
        int searchFrom = hardEnd - separator.length();
        int found = text.lastIndexOf(separator, searchFrom);
        if (found < 0) {
            return -1;
        }
        int end = found + separator.length();
        return end >= floor ? end : -1;
    }

    private static int lastSentenceEnd(String text, int floor, int hardEnd) {
        for (int i = hardEnd - 1; i >= floor; i--) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) && i > 0 && isTerminator(text.charAt(i - 1))) {
                return i + 1;
            }
        }
        return -1;
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
