package com.labelops.core.parse;

import com.labelops.config.ClientDefaults;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns pasted shipment notes into {@link AddressRecord}s. Blocks are separated by blank lines;
 * the first usable line of a block is the recipient name and the rest is the address.
 */
public final class RecordParser {
    static final int MIN_BLOCK_LINES = 2;

    private static final Pattern SERVICE_DIRECTIVE = Pattern.compile("^SERVICE\\s*=\\s*\\S.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKETED_TAG = Pattern.compile("^\\[[^\\]]+\\]$");
    private static final Pattern INLINE_BRACKETS = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern EMAIL = Pattern.compile("^[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s()-]+$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final ClientDefaults defaults;
    private final Set<String> directiveTags;

    /**
     * @param defaults values for fields the text does not carry
     * @param tags     service tags; a block whose first line is one of them treats it as a directive
     */
    public RecordParser(ClientDefaults defaults, Collection<String> tags) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        Set<String> normalized = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    normalized.add(tag.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        this.directiveTags = Set.copyOf(normalized);
    }

    public ParsedBatch parse(String rawText) {
        return new ParsedBatch(rawText == null ? "" : rawText, this);
    }

    /**
     * Parses one block. Blocks holding nothing but directives yield no outcome.
     */
    Optional<ParsedBlock> parseBlock(int index, String block) {
        List<String> lines = splitSingleLine(usableLines(block));
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        if (lines.size() < MIN_BLOCK_LINES) {
            return Optional.of(ParsedBlock.rejected(index, block, new ParseWarning(index, lines.size(),
                "need a name and at least one address line")));
        }
        return Optional.of(ParsedBlock.parsed(index, block, toRecord(lines)));
    }

    private List<String> usableLines(String block) {
        List<String> lines = new ArrayList<>();
        for (String rawLine : LINE_BREAK.split(block)) {
            String cleaned = TextCleaner.cleanLine(rawLine);
            if (cleaned.isEmpty() || isDirective(cleaned, lines.isEmpty())) {
                continue;
            }
            String withoutTags = TextCleaner.cleanLine(INLINE_BRACKETS.matcher(cleaned).replaceAll(" "));
            if (!withoutTags.isEmpty()) {
                lines.add(withoutTags);
            }
        }
        return lines;
    }

    /**
     * A block pasted as one comma separated line ("Name, street, town, postcode") becomes the name
     * followed by the rest of the line. A lone line without a comma is left as it is.
     */
    private static List<String> splitSingleLine(List<String> lines) {
        if (lines.size() != 1) {
            return lines;
        }
        String line = lines.get(0);
        int comma = line.indexOf(',');
        if (comma < 0) {
            return lines;
        }
        String name = TextCleaner.cleanLine(line.substring(0, comma));
        String rest = TextCleaner.cleanLine(line.substring(comma + 1));
        if (name.isEmpty() || rest.isEmpty()) {
            return lines;
        }
        return List.of(name, rest);
    }

    private boolean isDirective(String line, boolean beforeName) {
        if (SERVICE_DIRECTIVE.matcher(line).matches() || BRACKETED_TAG.matcher(line).matches()) {
            return true;
        }
        return beforeName && directiveTags.contains(line.toUpperCase(Locale.ROOT));
    }

    private AddressRecord toRecord(List<String> lines) {
        String fullName = TextCleaner.titleCase(lines.get(0));
        String postcode = "";
        String phone = "";
        String email = "";
        boolean ukCountry = false;
        String misspeltCountry = "";
        List<String> addressLines = new ArrayList<>();

        for (String line : lines.subList(1, lines.size())) {
            for (String rawPart : line.split(",")) {
                String part = TextCleaner.cleanLine(rawPart);
                if (part.isEmpty()) {
                    continue;
                }
                if (TextCleaner.isUkCountry(part)) {
                    ukCountry = true;
                    continue;
                }
                if (TextCleaner.isCountryTypo(part)) {
                    misspeltCountry = TextCleaner.countryKey(part);
                    continue;
                }
                if (EMAIL.matcher(part).matches()) {
                    email = part.toLowerCase(Locale.ROOT);
                    continue;
                }
                if (isPhone(part)) {
                    phone = part;
                    continue;
                }
                Optional<UkPostcodes.Extraction> extraction = UkPostcodes.extract(part);
                if (extraction.isPresent()) {
                    postcode = extraction.get().postcode();
                    part = extraction.get().remaining();
                }
                if (!part.isEmpty()) {
                    addressLines.add(TextCleaner.titleCase(part));
                }
            }
        }

        AddressLines assigned = AddressLines.assign(addressLines);
        return new AddressRecord(
            fullName,
            assigned.line1(),
            assigned.line2(),
            assigned.townCity(),
            assigned.county(),
            postcode,
            country(ukCountry, misspeltCountry),
            defaults.service(),
            defaults.weightKg(),
            null,
            phone,
            email,
            null,
            false
        );
    }

    private String country(boolean ukCountry, String misspeltCountry) {
        if (!misspeltCountry.isEmpty()) {
            return misspeltCountry;
        }
        return ukCountry ? ClientDefaults.DEFAULT_COUNTRY : defaults.countryOrDefault();
    }

    private static boolean isPhone(String part) {
        if (!PHONE.matcher(part).matches()) {
            return false;
        }
        long digits = part.chars().filter(Character::isDigit).count();
        return digits >= 10 && digits <= 13;
    }

    /**
     * Positional assignment of the address lines left after postcode, country and contact details
     * were taken out. Lines between the second and the last two are folded into line 2.
     */
    record AddressLines(String line1, String line2, String townCity, String county) {

        static AddressLines assign(List<String> lines) {
            return switch (lines.size()) {
                case 0 -> new AddressLines("", "", "", "");
                case 1 -> new AddressLines(lines.get(0), "", "", "");
                case 2 -> new AddressLines(lines.get(0), "", lines.get(1), "");
                case 3 -> new AddressLines(lines.get(0), lines.get(1), lines.get(2), "");
                default -> {
                    List<String> second = new ArrayList<>(lines.subList(1, lines.size() - 2));
                    yield new AddressLines(
                        lines.get(0),
                        String.join(", ", second),
                        lines.get(lines.size() - 2),
                        lines.get(lines.size() - 1));
                }
            };
        }
    }
}
