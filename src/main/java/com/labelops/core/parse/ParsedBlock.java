package com.labelops.core.parse;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one blank-line-delimited block: either a record or a warning.
 */
public final class ParsedBlock {
    private final int index;
    private final String text;
    private final AddressRecord record;
    private final ParseWarning warning;

    private ParsedBlock(int index, String text, AddressRecord record, ParseWarning warning) {
        this.index = index;
        this.text = Objects.requireNonNull(text, "text");
        this.record = record;
        this.warning = warning;
    }

    static ParsedBlock parsed(int index, String text, AddressRecord record) {
        return new ParsedBlock(index, text, Objects.requireNonNull(record, "record"), null);
    }

    static ParsedBlock rejected(int index, String text, ParseWarning warning) {
        return new ParsedBlock(index, text, null, Objects.requireNonNull(warning, "warning"));
    }

    public int index() {
        return index;
    }

    /**
     * Raw block text, used for service tag matching. Never log or persist it.
     */
    public String text() {
        return text;
    }

    public Optional<AddressRecord> record() {
        return Optional.ofNullable(record);
    }

    public Optional<ParseWarning> warning() {
        return Optional.ofNullable(warning);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ParsedBlock block)) {
            return false;
        }
        return index == block.index
            && text.equals(block.text)
            && Objects.equals(record, block.record)
            && Objects.equals(warning, block.warning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, text, record, warning);
    }
}
