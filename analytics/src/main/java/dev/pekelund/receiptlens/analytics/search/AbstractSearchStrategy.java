package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.springframework.util.StringUtils;

abstract class AbstractSearchStrategy implements SearchStrategy {

    private final Set<RecordField> supportedFields;
    private final boolean multipleFields;

    AbstractSearchStrategy(Set<RecordField> supportedFields, boolean multipleFields) {
        this.supportedFields = Collections.unmodifiableSet(EnumSet.copyOf(supportedFields));
        this.multipleFields = multipleFields;
    }

    @Override
    public Set<RecordField> supportedFields() {
        return supportedFields;
    }

    @Override
    public final void validate(SearchQuery query) {
        Objects.requireNonNull(query, "query");
        if (query.strategy() != type()) {
            throw new InvalidQueryException("strategy", query.strategy().id(),
                "Query for " + query.strategy().id() + " search handed to " + type().id() + " search");
        }
        if (query.fields().isEmpty()) {
            throw new InvalidQueryException("field", null, type().id() + " search needs a field");
        }
        if (!multipleFields && query.fields().size() > 1) {
            throw new InvalidQueryException("field", query.fields(), type().id() + " search runs on a single field");
        }
        for (RecordField field : query.fields()) {
            if (!supportedFields.contains(field)) {
                throw new UnsupportedFieldException(field, type().id() + " search");
            }
        }
        validateOperands(query);
    }

    @Override
    public final List<ReceiptRecord> search(List<ReceiptRecord> records, SearchQuery query) {
        validate(query);
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return new ArrayList<>();
        }
        return doSearch(new ArrayList<>(records), query);
    }

    protected abstract void validateOperands(SearchQuery query);

    /**
     * @param snapshot private copy of the input, safe to reorder
     */
    protected abstract List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query);

    static String requireTerm(SearchQuery query, String parameter) {
        if (!StringUtils.hasText(query.term())) {
            throw new InvalidQueryException(parameter, query.term(), "Search " + parameter + " must not be blank");
        }
        return query.term();
    }

    static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
