package com.labelops.core.parse;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Parse outcomes of one input text. Blocks are parsed on demand while iterating and every call
 * to {@link #iterator()} starts again from the first block.
 */
public final class ParsedBatch implements Iterable<ParsedBlock> {
    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t\\x0B\\f]*\\n\\s*");

    private final String text;
    private final RecordParser parser;

    ParsedBatch(String rawText, RecordParser parser) {
        this.text = rawText.replace("\r\n", "\n").replace('\r', '\n');
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public Iterator<ParsedBlock> iterator() {
        return new BlockIterator();
    }

    public Stream<ParsedBlock> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public List<AddressRecord> records() {
        return stream()
            .map(ParsedBlock::record)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    public List<ParseWarning> warnings() {
        return stream()
            .map(ParsedBlock::warning)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    private final class BlockIterator implements Iterator<ParsedBlock> {
        private final Matcher separator = BLOCK_SEPARATOR.matcher(text);
        private int position;
        private int blockIndex;
        private ParsedBlock next;

        @Override
        public boolean hasNext() {
            while (next == null && position < text.length()) {
                String block;
                if (separator.find(position)) {
                    block = text.substring(position, separator.start());
                    position = separator.end();
                } else {
                    block = text.substring(position);
                    position = text.length();
                }
                if (block.isBlank()) {
                    continue;
                }
                blockIndex++;
                next = parser.parseBlock(blockIndex, block).orElse(null);
            }
            return next != null;
        }

        @Override
        public ParsedBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ParsedBlock current = next;
            next = null;
            return current;
        }
    }
}
