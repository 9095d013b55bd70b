package io.github.eutro.funclets.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The results of validating every body of a module, in function index order.
 */
public final class ModuleValidation {
    public final ModuleReader.ModuleContents module;
    public final List<BodyResult> results;

    ModuleValidation(ModuleReader.ModuleContents module, List<BodyResult> results) {
        this.module = module;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public boolean isValid() {
        return failures().isEmpty();
    }

    public List<BodyResult> failures() {
        List<BodyResult> failures = new ArrayList<>();
        for (BodyResult result : results) {
            if (!result.isValid()) failures.add(result);
        }
        return failures;
    }

    public BodyResult get(int funcIndex) {
        for (BodyResult result : results) {
            if (result.funcIndex == funcIndex) return result;
        }
        throw new IllegalArgumentException("no body for function " + funcIndex);
    }
}
