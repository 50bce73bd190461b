package com.zookies.zkbackend.model.attestation;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of interest tags understood by the ThresholdProof circuit.
 * The numeric id is the value the circuit receives as {@code targetTag}; ids are 1-based and
 * must never be renumbered without recompiling the circuit and bumping {@link #DICTIONARY_VERSION}.
 */
@Getter
public enum InterestTag {

    DEFI("defi", 1),
    PRIVACY("privacy", 2),
    TRAVEL("travel", 3),
    GAMING("gaming", 4),
    TECHNOLOGY("technology", 5),
    FINANCE("finance", 6);

    public static final int DICTIONARY_VERSION = 1;

    /** Id used when a tag cannot be resolved at circuit-input build time. */
    public static final int DEFAULT_TAG_ID = DEFI.id;

    private final String tagName;
    private final int id;

    InterestTag(String tagName, int id) {
        this.tagName = tagName;
        this.id = id;
    }

    @JsonValue
    public String getTagName() {
        return tagName;
    }

    public static Optional<InterestTag> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.tagName.equals(normalized)).findFirst();
    }

    public static Optional<InterestTag> fromId(long id) {
        return Arrays.stream(values()).filter(t -> t.id == id).findFirst();
    }

    public static boolean isSupported(String name) {
        return fromName(name).isPresent();
    }

    public static int resolveIdOrDefault(String name) {
        return fromName(name).map(InterestTag::getId).orElse(DEFAULT_TAG_ID);
    }

    @Override
    public String toString() {
        return tagName;
    }

}
