package com.docsum.core.chunking;

import com.docsum.core.model.TextChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits document text into overlapping chunks of bounded size.
 *
 * <p>Strategy:
 * <ul>
 *   <li>Short documents (trimmed length ≤ chunkSize): a single chunk, no fan-out</li>
 *   <li>Long documents: split on the first separator present in the text
 *       (paragraphs → lines → sentences → clauses → words → characters), merge the pieces
 *       greedily up to chunkSize, and split again with the next separator any piece that is
 *       still too large</li>
 * </ul>
 * A separator stays attached to the start of the piece that follows it, so no characters
 * are lost except whitespace trimmed from chunk edges. When a chunk is emitted, its trailing
 * pieces, up to {@code overlap} characters, are carried over to begin the next chunk.
 *
 * <p>Pure function of its arguments: no state, no clock, safe to share.
 */
@Component
@Slf4j
public class RecursiveTextChunker {
    
    static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", ", ", " ", "");
    
    public List<TextChunk> split(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                "overlap must be in [0, chunkSize): overlap=" + overlap + ", chunkSize=" + chunkSize);
        }
        if (text == null) {
            return List.of();
        }
        
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.length() <= chunkSize) {
            return List.of(TextChunk.of(0, trimmed));
        }
        
        List<String> pieces = splitRecursively(trimmed, SEPARATORS, chunkSize, overlap);
        List<TextChunk> chunks = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            String content = piece.strip();
            if (!content.isEmpty()) {
                chunks.add(TextChunk.of(chunks.size(), content));
            }
        }
        
        log.debug("Split {} characters into {} chunks | chunkSize={} | overlap={}",
            trimmed.length(), chunks.size(), chunkSize, overlap);
        return chunks;
    }
    
    private List<String> splitRecursively(String text, List<String> separators, int chunkSize, int overlap) {
        String separator = separators.get(separators.size() - 1);
        List<String> finerSeparators = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finerSeparators = separators.subList(i + 1, separators.size());
                break;
            }
        }
        
        List<String> chunks = new ArrayList<>();
        List<String> smallPieces = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                smallPieces.add(piece);
                continue;
            }
            if (!smallPieces.isEmpty()) {
                chunks.addAll(mergePieces(smallPieces, chunkSize, overlap));
                smallPieces = new ArrayList<>();
            }
            if (finerSeparators.isEmpty()) {
                chunks.add(piece);
            } else {
                chunks.addAll(splitRecursively(piece, finerSeparators, chunkSize, overlap));
            }
        }
        if (!smallPieces.isEmpty()) {
            chunks.addAll(mergePieces(smallPieces, chunkSize, overlap));
        }
        return chunks;
    }
    
    /**
     * "a. b. c" on ". " gives ["a", ". b", ". c"]; the empty separator gives single code points.
     */
    static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }
        
        int pieceStart = 0;
        int searchFrom = 0;
        int found;
        while ((found = text.indexOf(separator, searchFrom)) >= 0) {
            addIfNotEmpty(pieces, text.substring(pieceStart, found));
            pieceStart = found;
            searchFrom = found + separator.length();
        }
        addIfNotEmpty(pieces, text.substring(pieceStart));
        return pieces;
    }
    
    private List<String> mergePieces(List<String> pieces, int chunkSize, int overlap) {
        List<String> merged = new ArrayList<>();
        Deque<String> current = new ArrayDeque<>();
        int total = 0;
        
        for (String piece : pieces) {
            int length = piece.length();
            if (total + length > chunkSize && !current.isEmpty()) {
                addIfNotBlank(merged, String.join("", current));
                // Keep a tail of at most `overlap` chars that still leaves room for this piece
                while (total > overlap || (total + length > chunkSize && total > 0)) {
                    total -= current.removeFirst().length();
                }
            }
            current.addLast(piece);
            total += length;
        }
        addIfNotBlank(merged, String.join("", current));
        return merged;
    }
    
    private static void addIfNotEmpty(List<String> target, String value) {
        if (!value.isEmpty()) {
            target.add(value);
        }
    }
    
    private static void addIfNotBlank(List<String> target, String value) {
        String stripped = value.strip();
        if (!stripped.isEmpty()) {
            target.add(stripped);
        }
    }
}
