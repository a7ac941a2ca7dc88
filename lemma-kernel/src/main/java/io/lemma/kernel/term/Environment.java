package io.lemma.kernel.term;

import io.lemma.core.engine.NameCandidate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Global declarations of the kernel: name to type.
///
/// The environment is fixed for the lifetime of an engine and is not part of any
/// snapshot.
public final class Environment {

    private final Map<String, Term> declarations;

    private Environment(Map<String, Term> declarations) {
        this.declarations = Map.copyOf(declarations);
    }

    /// Returns the built-in environment: `Type`, `Prop`, `Nat` with `zero`, `succ` and
    /// `add`, `Bool` with `true` and `false`, and `True` with `intro`.
    public static Environment standard() {
        Term type = new Term.Const("Type");
        Term prop = new Term.Const("Prop");
        Term nat = new Term.Const("Nat");
        Term bool = new Term.Const("Bool");
        Term truth = new Term.Const("True");

        Map<String, Term> decls = new LinkedHashMap<>();
        decls.put("Prop", type);
        decls.put("Nat", type);
        decls.put("Nat.zero", nat);
        decls.put("Nat.succ", new Term.Arrow(nat, nat));
        decls.put("Nat.add", new Term.Arrow(nat, new Term.Arrow(nat, nat)));
        decls.put("Bool", type);
        decls.put("Bool.true", bool);
        decls.put("Bool.false", bool);
        decls.put("True", prop);
        decls.put("True.intro", truth);
        return new Environment(decls);
    }

    /// Returns the type of a global declaration.
    ///
    /// @param name fully qualified name, not null
    /// @return declared type, or empty if undeclared
    public Optional<Term> typeOf(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    /// Resolves a possibly dotted name.
    ///
    /// The name is tried as written and then inside each open namespace. For each
    /// qualified form every declared prefix is a candidate, longest first, with the
    /// remaining components reported as field accesses.
    ///
    /// @param name name to resolve, not null
    /// @param openNamespaces namespaces to search after the root namespace, not null
    /// @return distinct candidates, never null
    public List<NameCandidate> resolve(String name, List<String> openNamespaces) {
        List<NameCandidate> candidates = new ArrayList<>();
        List<String> qualified = new ArrayList<>();
        qualified.add(name);
        for (String namespace : openNamespaces) {
            qualified.add(namespace + "." + name);
        }
        for (String full : qualified) {
            List<String> components = Arrays.asList(full.split("\\."));
            for (int k = components.size(); k >= 1; k--) {
                String prefix = String.join(".", components.subList(0, k));
                if (declarations.containsKey(prefix)) {
                    NameCandidate candidate =
                            new NameCandidate(prefix, components.subList(k, components.size()));
                    if (!candidates.contains(candidate)) {
                        candidates.add(candidate);
                    }
                }
            }
        }
        return candidates;
    }
}
