package org.dxworks.lintframe.scope;

import java.util.Objects;
import java.util.Optional;

/**
 * What a local variable is known to hold. Anything the tracker cannot prove is {@link #UNKNOWN}.
 */
public abstract class Provenance {

    public enum Kind {
        UNKNOWN,
        MODEL_CLASS,
        ELOQUENT_BUILDER,
        QUERY_BUILDER,
        TRANSACTION_PROTECTED
    }

    public static final Provenance UNKNOWN = new Unknown();
    public static final Provenance TRANSACTION_PROTECTED = new TransactionProtected();

    private Provenance() {
    }

    public abstract Kind kind();

    public static Provenance modelClass(String model) {
        return new ModelClass(model, EagerLoadSet.EMPTY);
    }

    public static Provenance modelClass(String model, EagerLoadSet eagerLoads) {
        return new ModelClass(model, eagerLoads);
    }

    public static Provenance eloquentBuilder(String model, EagerLoadSet eagerLoads) {
        return new EloquentBuilder(model, eagerLoads);
    }

    public static Provenance queryBuilder(String table) {
        return new QueryBuilder(table);
    }

    /** Model FQCN for model and Eloquent builder provenance. */
    public Optional<String> model() {
        return Optional.empty();
    }

    public Optional<String> table() {
        return Optional.empty();
    }

    public EagerLoadSet eagerLoads() {
        return EagerLoadSet.EMPTY;
    }

    public static final class Unknown extends Provenance {
        private Unknown() {
        }

        @Override
        public Kind kind() {
            return Kind.UNKNOWN;
        }

        @Override
        public String toString() {
            return "Unknown";
        }
    }

    /** A fetched model instance or collection whose origin model is known. */
    public static final class ModelClass extends Provenance {
        private final String model;
        private final EagerLoadSet eagerLoads;

        private ModelClass(String model, EagerLoadSet eagerLoads) {
            this.model = model;
            this.eagerLoads = eagerLoads;
        }

        @Override
        public Kind kind() {
            return Kind.MODEL_CLASS;
        }

        @Override
        public Optional<String> model() {
            return Optional.of(model);
        }

        @Override
        public EagerLoadSet eagerLoads() {
            return eagerLoads;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ModelClass other && model.equals(other.model) && eagerLoads.equals(other.eagerLoads);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), model, eagerLoads);
        }

        @Override
        public String toString() {
            return "ModelClass(" + model + ")";
        }
    }

    /** An Eloquent query that has not been executed yet. */
    public static final class EloquentBuilder extends Provenance {
        private final String model;
        private final EagerLoadSet eagerLoads;

        private EloquentBuilder(String model, EagerLoadSet eagerLoads) {
            this.model = model;
            this.eagerLoads = eagerLoads;
        }

        @Override
        public Kind kind() {
            return Kind.ELOQUENT_BUILDER;
        }

        @Override
        public Optional<String> model() {
            return Optional.of(model);
        }

        @Override
        public EagerLoadSet eagerLoads() {
            return eagerLoads;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EloquentBuilder other && model.equals(other.model) && eagerLoads.equals(other.eagerLoads);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), model, eagerLoads);
        }

        @Override
        public String toString() {
            return "EloquentBuilder(" + model + ")";
        }
    }

    /** A fluent query builder on a literal table. */
    public static final class QueryBuilder extends Provenance {
        private final String table;

        private QueryBuilder(String table) {
            this.table = table;
        }

        @Override
        public Kind kind() {
            return Kind.QUERY_BUILDER;
        }

        @Override
        public Optional<String> table() {
            return Optional.of(table);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof QueryBuilder other && table.equals(other.table);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), table);
        }

        @Override
        public String toString() {
            return "QueryBuilder(" + table + ")";
        }
    }

    public static final class TransactionProtected extends Provenance {
        private TransactionProtected() {
        }

        @Override
        public Kind kind() {
            return Kind.TRANSACTION_PROTECTED;
        }

        @Override
        public String toString() {
            return "TransactionProtected";
        }
    }
}
