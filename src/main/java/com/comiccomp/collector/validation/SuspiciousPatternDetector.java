package com.comiccomp.collector.validation;

import com.comiccomp.collector.config.ValidationProperties;
import com.comiccomp.collector.model.RawListing;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scans listing text against the configured blocklists.
 * <p>
 * Price and title matches are hard errors that block the listing; description and
 * seller matches only warn. At most one finding is reported per field.
 * </p>
 */
public class SuspiciousPatternDetector {

    private final List<Pattern> pricePatterns;

    private final List<Pattern> titlePatterns;

    private final List<Pattern> descriptionPatterns;

    private final List<Pattern> sellerPatterns;

    public SuspiciousPatternDetector(final ValidationProperties.SuspiciousPatterns config) {
        this.pricePatterns = compile(config.getPrice());
        this.titlePatterns = compile(config.getTitle());
        this.descriptionPatterns = compile(config.getDescription());
        this.sellerPatterns = compile(config.getSeller());
    }

    /**
     * @param listing the raw listing
     * @return the errors and warnings raised
     */
    public Findings scan(final RawListing listing) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String price = listing.getPrice();
        if (price != null && !price.isBlank()) {
            List<String> forms = new ArrayList<>(2);
            forms.add(price.trim());
            ListingNormalizer.parsePrice(price).ifPresent(p -> forms.add("$" + p.toPlainString()));
            if (firstMatch(pricePatterns, forms).isPresent()) {
                errors.add("Suspicious price pattern detected: " + price.trim());
            }
        }
        String title = listing.getTitle();
        if (title != null && firstMatch(titlePatterns, List.of(title)).isPresent()) {
            errors.add("Suspicious title pattern detected: " + title);
        }
        String description = listing.getDescription();
        if (description != null && firstMatch(descriptionPatterns, List.of(description)).isPresent()) {
            warnings.add("Suspicious description pattern detected");
        }
        if (listing.getSellerInfo() != null
                && firstMatch(sellerPatterns, List.of(listing.getSellerInfo().asSearchableText())).isPresent()) {
            warnings.add("Suspicious seller pattern detected");
        }
        return new Findings(List.copyOf(errors), List.copyOf(warnings));
    }

    private static Optional<Pattern> firstMatch(final List<Pattern> patterns, final List<String> texts) {
        for (Pattern pattern : patterns) {
            for (String text : texts) {
                if (pattern.matcher(text).find()) {
                    return Optional.of(pattern);
                }
            }
        }
        return Optional.empty();
    }

    private static List<Pattern> compile(final List<String> regexes) {
        return regexes == null ? List.of() : regexes.stream().map(Pattern::compile).toList();
    }

    /**
     * Result of a scan.
     *
     * @param errors   blocking findings
     * @param warnings advisory findings
     */
    public record Findings(List<String> errors, List<String> warnings) {

        public boolean blocked() {
            return !errors.isEmpty();
        }
    }
}
