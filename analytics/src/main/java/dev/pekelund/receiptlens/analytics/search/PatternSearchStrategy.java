package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidSearchPatternException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regular-expression search ({@link java.util.regex.Matcher#find()}, case-insensitive) against text fields.
 * An invalid expression is reported as {@link InvalidSearchPatternException}, never as an empty result.
 */
public class PatternSearchStrategy extends AbstractSearchStrategy {

    public PatternSearchStrategy() {
        super(EnumSet.of(RecordField.VENDOR, RecordField.CATEGORY, RecordField.RAW_TEXT), true);
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.PATTERN;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        compile(requireTerm(query, "pattern"));
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        Pattern pattern = compile(query.term());
        List<ReceiptRecord> matches = new ArrayList<>();
        for (ReceiptRecord record : snapshot) {
            for (RecordField field : query.fields()) {
                String value = field.textValueOf(record);
                if (value != null && pattern.matcher(value).find()) {
                    matches.add(record);
                    break;
                }
            }
        }
        return matches;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException ex) {
            throw new InvalidSearchPatternException(regex, ex);
        }
    }
}
