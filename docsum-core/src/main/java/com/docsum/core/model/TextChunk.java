package com.docsum.core.model;

import lombok.Value;

/**
 * One bounded, zero-indexed slice of the document text.
 */
@Value
public class TextChunk {
    int index;
    String content;
    int length;
    
    public static TextChunk of(int index, String content) {
        return new TextChunk(index, content, content.length());
    }
}
