package io.github.eutro.funclets.bytecode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A function or block type: parameter types, and result types.
 * <p>
 * Funclet signatures never have results, since all control leaves a funclet through a tail call.
 */
public final class Signature {
    public static final Signature EMPTY = new Signature(Collections.emptyList(), Collections.emptyList());

    public final List<ValType> params;
    public final List<ValType> results;

    public Signature(List<ValType> params, List<ValType> results) {
        this.params = Collections.unmodifiableList(Arrays.asList(params.toArray(new ValType[0])));
        this.results = Collections.unmodifiableList(Arrays.asList(results.toArray(new ValType[0])));
    }

    public static Signature of(ValType[] params, ValType... results) {
        return new Signature(Arrays.asList(params), Arrays.asList(results));
    }

    public static Signature params(ValType... params) {
        return new Signature(Arrays.asList(params), Collections.emptyList());
    }

    public static Signature results(ValType... results) {
        return new Signature(Collections.emptyList(), Arrays.asList(results));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature)) return false;
        Signature that = (Signature) o;
        return params.equals(that.params) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return 31 * params.hashCode() + results.hashCode();
    }

    @Override
    public String toString() {
        return ValType.format(params) + " -> " + ValType.format(results);
    }
}
