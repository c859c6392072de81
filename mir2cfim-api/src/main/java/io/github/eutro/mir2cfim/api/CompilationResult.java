package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a {@link CrateCompilation}.
 */
public final class CompilationResult {
    private final List<FunDecl> declarations;
    private final List<DeclarationFailure> failures;

    CompilationResult(List<FunDecl> declarations, List<DeclarationFailure> failures) {
        this.declarations = Collections.unmodifiableList(declarations);
        this.failures = Collections.unmodifiableList(failures);
    }

    /**
     * Get the structured declarations that were emitted, in submission order.
     *
     * @return The declarations.
     */
    public List<FunDecl> getDeclarations() {
        return declarations;
    }

    /**
     * Get the declarations that could not be structured, in submission order.
     *
     * @return The failures.
     */
    public List<DeclarationFailure> getFailures() {
        return failures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * Find an emitted declaration by name.
     *
     * @param name The name.
     * @return The first declaration with that name, or null if there is none.
     */
    @Nullable
    public FunDecl getDeclaration(String name) {
        for (FunDecl decl : declarations) {
            if (decl.name.equals(name)) return decl;
        }
        return null;
    }
}
