package com.naagi.kb.core.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * BPE token counts for the cl100k_base encoding used by the OpenAI embedding models.
 */
public final class Cl100kTokenCounter implements TokenCounter {

    public static final String NAME = "cl100k";

    private final Encoding encoding;

    public Cl100kTokenCounter() {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        return encoding.countTokens(text);
    }

    @Override
    public String name() {
        return NAME;
    }
}
