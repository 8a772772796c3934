package com.courtrag.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Structured case attributes of one ruling.
 *
 * <p>A scalar field is either a non-blank value or unknown (absent). The party
 * list keeps extraction order and holds no duplicates; an empty list means the
 * parties are unknown. Instances are immutable.</p>
 */
@EqualsAndHashCode
@ToString
public final class MetadataRecord {

    public static final String UNKNOWN = "unknown";

    private static final MetadataRecord EMPTY = new MetadataRecord(new EnumMap<>(MetadataField.class), List.of(), false);

    private final Map<MetadataField, String> values;
    private final List<String> parties;
    private final boolean partiallyAmbiguous;

    private MetadataRecord(Map<MetadataField, String> values, List<String> parties, boolean partiallyAmbiguous) {
        this.values = Collections.unmodifiableMap(values);
        this.parties = List.copyOf(parties);
        this.partiallyAmbiguous = partiallyAmbiguous;
    }

    public static MetadataRecord empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        builder.parties.addAll(parties);
        builder.partiallyAmbiguous = partiallyAmbiguous;
        return builder;
    }

    /**
     * Value of a scalar field. For {@link MetadataField#PARTIES} the parties are
     * joined with {@code "; "}.
     */
    public Optional<String> get(MetadataField field) {
        if (field.isMultiValued()) {
            return parties.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", parties));
        }
        return Optional.ofNullable(values.get(field));
    }

    /**
     * All values of a field: the party list, or zero or one scalar value.
     */
    public List<String> values(MetadataField field) {
        if (field.isMultiValued()) {
            return parties;
        }
        String value = values.get(field);
        return value == null ? List.of() : List.of(value);
    }

    public String valueOrUnknown(MetadataField field) {
        return get(field).orElse(UNKNOWN);
    }

    public boolean isKnown(MetadataField field) {
        return !values(field).isEmpty();
    }

    public List<String> getParties() {
        return parties;
    }

    public boolean isPartiallyAmbiguous() {
        return partiallyAmbiguous;
    }

    public Optional<Integer> year() {
        return get(MetadataField.YEAR).map(Integer::valueOf);
    }

    public Optional<LocalDate> decisionDate() {
        try {
            return get(MetadataField.DECISION_DATE).map(LocalDate::parse);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Most precise known point in time of the decision, used for recency ordering.
     */
    public Optional<LocalDate> recency() {
        Optional<LocalDate> date = decisionDate();
        if (date.isPresent()) {
            return date;
        }
        return year().map(y -> LocalDate.of(y, 1, 1));
    }

    public boolean isEmpty() {
        return values.isEmpty() && parties.isEmpty();
    }

    public int knownFieldCount() {
        int count = values.size();
        return parties.isEmpty() ? count : count + 1;
    }

    /**
     * Serializable view keyed by field wire names, unknown values rendered as
     * {@value #UNKNOWN}.
     */
    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        for (MetadataField field : MetadataField.values()) {
            if (field.isMultiValued()) {
                view.put(field.getKey(), parties.isEmpty() ? UNKNOWN : parties);
            } else {
                view.put(field.getKey(), valueOrUnknown(field));
            }
        }
        view.put("partially_ambiguous", partiallyAmbiguous);
        return view;
    }

    public static final class Builder {

        private final Map<MetadataField, String> values = new EnumMap<>(MetadataField.class);
        private final Set<String> parties = new LinkedHashSet<>();
        private boolean partiallyAmbiguous;

        private Builder() {
        }

        /**
         * Sets a field; a null, blank or {@value #UNKNOWN} value clears it.
         */
        public Builder set(MetadataField field, String value) {
            if (field.isMultiValued()) {
                parties.clear();
                if (value != null) {
                    for (String party : value.split(";")) {
                        addParty(party);
                    }
                }
                return this;
            }
            if (value == null || value.isBlank() || UNKNOWN.equalsIgnoreCase(value.trim())) {
                values.remove(field);
            } else {
                values.put(field, value.trim());
            }
            return this;
        }

        public Builder addParty(String party) {
            if (party != null && !party.isBlank() && !UNKNOWN.equalsIgnoreCase(party.trim())) {
                parties.add(party.trim());
            }
            return this;
        }

        public Builder parties(List<String> names) {
            parties.clear();
            names.forEach(this::addParty);
            return this;
        }

        public Builder partiallyAmbiguous(boolean flag) {
            this.partiallyAmbiguous = flag;
            return this;
        }

        public MetadataRecord build() {
            return new MetadataRecord(new EnumMap<>(values), new ArrayList<>(parties), partiallyAmbiguous);
        }
    }
}
