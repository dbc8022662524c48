/* Copyright (C) 2021 – University of Mons, University Antwerpen
 * This file is part of VASSReach.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.vassreach.api.solver;

import java.util.Objects;

import de.vassreach.api.path.Path;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The answer to a zero-reachability query.
 * 
 * A true verdict always carries a witness path. An unknown verdict carries the
 * reason, and the exceeded limit when the reason is an exhausted budget.
 * 
 * @param <I> Label type
 * @author Gaëtan Staquet
 */
public final class Verdict<I> {

    public enum Status {
        TRUE, FALSE, UNKNOWN
    }

    public enum UnknownReason {
        BUDGET_EXHAUSTED, INTERRUPTED
    }

    private final Status status;
    private final @Nullable Path<I> witness;
    private final @Nullable UnknownReason reason;
    private final SearchBudget.@Nullable Limit limit;

    private Verdict(Status status, @Nullable Path<I> witness, @Nullable UnknownReason reason,
            SearchBudget.@Nullable Limit limit) {
        this.status = status;
        this.witness = witness;
        this.reason = reason;
        this.limit = limit;
    }

    public static <I> Verdict<I> reachable(Path<I> witness) {
        return new Verdict<>(Status.TRUE, witness, null, null);
    }

    public static <I> Verdict<I> unreachable() {
        return new Verdict<>(Status.FALSE, null, null, null);
    }

    public static <I> Verdict<I> budgetExhausted(SearchBudget.Limit limit) {
        return new Verdict<>(Status.UNKNOWN, null, UnknownReason.BUDGET_EXHAUSTED, limit);
    }

    public static <I> Verdict<I> interrupted() {
        return new Verdict<>(Status.UNKNOWN, null, UnknownReason.INTERRUPTED, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isTrue() {
        return status == Status.TRUE;
    }

    public boolean isFalse() {
        return status == Status.FALSE;
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }

    /**
     * @return The witness
     * @throws IllegalStateException If the verdict is not true
     */
    public Path<I> getWitness() {
        if (witness == null) {
            throw new IllegalStateException("Only a true verdict has a witness");
        }
        return witness;
    }

    public @Nullable UnknownReason getReason() {
        return reason;
    }

    public SearchBudget.@Nullable Limit getLimit() {
        return limit;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Verdict<?> o = (Verdict<?>) obj;
        return o.status == status && o.reason == reason && o.limit == limit && Objects.equals(o.witness, witness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, witness, reason, limit);
    }

    @Override
    public String toString() {
        switch (status) {
        case TRUE:
            return "True(" + witness + ")";
        case FALSE:
            return "False";
        default:
            return "Unknown(" + reason + (limit == null ? "" : ", " + limit) + ")";
        }
    }
}
