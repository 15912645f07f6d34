package com.tony.theoryEngine.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tony.theoryEngine.model.engine.ReasonCode;

import java.util.Optional;

/**
 * Résultat d'une étape optionnelle : indisponible (données insuffisantes ou échec),
 * non exécutée (non éligible / non demandée) ou complète.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StageStatus.Unavailable.class, name = "unavailable"),
        @JsonSubTypes.Type(value = StageStatus.NotRun.class, name = "not_run"),
        @JsonSubTypes.Type(value = StageStatus.Complete.class, name = "complete")
})
public interface StageStatus<T> {

    record Unavailable<T>(ReasonCode reasonCode, String message) implements StageStatus<T> {
    }

    record NotRun<T>(ReasonCode reasonCode, String eligibility) implements StageStatus<T> {
    }

    record Complete<T>(T result) implements StageStatus<T> {
        @Override
        public Optional<T> completed() {
            return Optional.ofNullable(result);
        }
    }

    static <T> StageStatus<T> unavailable(ReasonCode reasonCode, String message) {
        return new Unavailable<>(reasonCode, message);
    }

    static <T> StageStatus<T> notRun(ReasonCode reasonCode, String eligibility) {
        return new NotRun<>(reasonCode, eligibility);
    }

    static <T> StageStatus<T> complete(T result) {
        return new Complete<>(result);
    }

    default Optional<T> completed() {
        return Optional.empty();
    }

    @JsonIgnore
    default boolean isComplete() {
        return this instanceof Complete;
    }
}
