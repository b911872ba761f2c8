package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.value.Document;
import java.util.List;

/** A decoded document together with the diagnostics collected while decoding it. */
public final class DecodeResult {
    private final Document document;
    private final List<DecodeMessage> messages;

    public DecodeResult(Document document, List<DecodeMessage> messages) {
        this.document = document;
        this.messages = List.copyOf(messages);
    }

    public Document getDocument() {
        return document;
    }

    public List<DecodeMessage> getMessages() {
        return messages;
    }
}
