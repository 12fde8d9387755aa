package com.counteragent.argumentation.core;

import com.counteragent.argumentation.exceptions.TooLargeException;
import io.quarkus.logging.Log;

import java.util.*;

/**
 * Computes acceptance semantics over an {@link ArgumentationFramework}.
 * <p>
 * The grounded extension is the least fixpoint of the characteristic function and is always cheap
 * to compute. Complete extensions are enumerated by backtracking and are exponential in the worst
 * case, so enumeration is refused with {@link TooLargeException} above the node-count cap.
 * </p>
 * Instances hold no mutable state and may be shared between threads.
 */
public final class ExtensionCalculator {

    public static final int DEFAULT_ENUMERATION_CAP = 32;

    private final int enumerationCap;

    public ExtensionCalculator() {
        this(DEFAULT_ENUMERATION_CAP);
    }

    public ExtensionCalculator(int enumerationCap) {
        if (enumerationCap < 0) {
            throw new IllegalArgumentException("Enumeration cap must be >= 0, was " + enumerationCap);
        }
        this.enumerationCap = enumerationCap;
    }

    public int enumerationCap() {
        return enumerationCap;
    }

    public boolean canEnumerate(ArgumentationFramework af) {
        return af.size() <= enumerationCap;
    }

    /**
     * Characteristic function {@code F(S)}: every node whose attackers are all attacked by some
     * member of {@code s}.
     */
    public Set<ArgumentRef> characteristic(ArgumentationFramework af, Set<ArgumentRef> s) {
        Set<ArgumentRef> defended = new LinkedHashSet<>();
        for (ArgumentRef node : af.nodes()) {
            if (isDefendedBy(af, node, s)) {
                defended.add(node);
            }
        }
        return defended;
    }

    public boolean isDefendedBy(ArgumentationFramework af, ArgumentRef node, Set<ArgumentRef> s) {
        for (ArgumentRef attacker : af.attackersOf(node)) {
            boolean counterAttacked = false;
            for (ArgumentRef defender : af.attackersOf(attacker)) {
                if (s.contains(defender)) {
                    counterAttacked = true;
                    break;
                }
            }
            if (!counterAttacked) {
                return false;
            }
        }
        return true;
    }

    public boolean isConflictFree(ArgumentationFramework af, Set<ArgumentRef> s) {
        for (ArgumentRef member : s) {
            for (ArgumentRef target : af.attackedBy(member)) {
                if (s.contains(target)) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isAdmissible(ArgumentationFramework af, Set<ArgumentRef> s) {
        if (!isConflictFree(af, s)) {
            return false;
        }
        for (ArgumentRef member : s) {
            if (!isDefendedBy(af, member, s)) {
                return false;
            }
        }
        return true;
    }

    public boolean isComplete(ArgumentationFramework af, Set<ArgumentRef> s) {
        return isAdmissible(af, s) && characteristic(af, s).equals(s);
    }

    /**
     * Iterates {@code S(i+1) = F(S(i))} from the empty set until it stabilises. F is monotonic, so
     * the sequence grows and converges in at most {@code |nodes|} steps.
     */
    public Extension grounded(ArgumentationFramework af) {
        Set<ArgumentRef> current = new LinkedHashSet<>();
        int iterations = 0;
        while (true) {
            Set<ArgumentRef> next = characteristic(af, current);
            iterations++;
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        Log.debugf("Grounded extension of %d arguments reached after %d iterations: %s",
                af.size(), iterations, current);
        return new Extension(Extension.Kind.GROUNDED, current);
    }

    public Labelling groundedLabelling(ArgumentationFramework af) {
        return Labelling.fromExtension(af, grounded(af));
    }

    public List<Extension> complete(ArgumentationFramework af) {
        return complete(af, grounded(af));
    }

    /**
     * Enumerates every complete extension, reusing an already computed grounded extension.
     * <p>
     * Every complete extension contains the grounded one and excludes everything it attacks, so the
     * search only branches on the nodes left UNDEC by the grounded labelling. A node is included only
     * when that keeps the candidate conflict-free and every member can still be defended by nodes not
     * yet decided; it is excluded only when the candidate does not already defend it. Surviving
     * leaves are kept when admissible and a fixpoint of {@link #characteristic}.
     * </p>
     * No ordering is guaranteed among the returned extensions.
     *
     * @throws TooLargeException if the framework has more nodes than the enumeration cap
     */
    public List<Extension> complete(ArgumentationFramework af, Extension grounded) {
        if (!canEnumerate(af)) {
            throw new TooLargeException(af.size(), enumerationCap);
        }
        Labelling base = Labelling.fromExtension(af, grounded);
        List<ArgumentRef> undecided = new ArrayList<>(base.undec());
        Map<ArgumentRef, Integer> position = new HashMap<>();
        for (int i = 0; i < undecided.size(); i++) {
            position.put(undecided.get(i), i);
        }
        List<Extension> found = new ArrayList<>();
        search(af, undecided, position, 0, new LinkedHashSet<>(grounded.members()), new LinkedHashSet<>(), found);
        Log.debugf("Enumerated %d complete extension(s) over %d arguments (%d undecided)",
                found.size(), af.size(), undecided.size());
        return found;
    }

    /**
     * Nodes in {@code undecided} before {@code index} are decided: members of {@code candidate} are
     * included, members of {@code excluded} are not. Both branches are cut as soon as they can no
     * longer reach a complete extension.
     */
    private void search(ArgumentationFramework af,
                        List<ArgumentRef> undecided,
                        Map<ArgumentRef, Integer> position,
                        int index,
                        Set<ArgumentRef> candidate,
                        Set<ArgumentRef> excluded,
                        List<Extension> found) {
        if (index == undecided.size()) {
            if (isAdmissible(af, candidate) && characteristic(af, candidate).equals(candidate)) {
                found.add(new Extension(Extension.Kind.COMPLETE, candidate));
            }
            return;
        }
        ArgumentRef node = undecided.get(index);
        if (compatible(af, node, candidate)) {
            candidate.add(node);
            if (defensible(af, candidate, position, index + 1) && noneDefended(af, excluded, candidate)) {
                search(af, undecided, position, index + 1, candidate, excluded, found);
            }
            candidate.remove(node);
        }
        // a node already defended by the candidate stays defended as it grows, so it must be included
        if (!isDefendedBy(af, node, candidate)) {
            excluded.add(node);
            search(af, undecided, position, index + 1, candidate, excluded, found);
            excluded.remove(node);
        }
    }

    /**
     * Every attacker of a candidate member is either attacked by the candidate already or by some
     * node still open (not yet decided) that could join the candidate without conflict.
     */
    private boolean defensible(ArgumentationFramework af,
                               Set<ArgumentRef> candidate,
                               Map<ArgumentRef, Integer> position,
                               int nextIndex) {
        for (ArgumentRef member : candidate) {
            for (ArgumentRef attacker : af.attackersOf(member)) {
                boolean defendable = false;
                for (ArgumentRef defender : af.attackersOf(attacker)) {
                    if (candidate.contains(defender)) {
                        defendable = true;
                        break;
                    }
                    Integer at = position.get(defender);
                    if (at != null && at >= nextIndex && compatible(af, defender, candidate)) {
                        defendable = true;
                        break;
                    }
                }
                if (!defendable) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean noneDefended(ArgumentationFramework af, Set<ArgumentRef> excluded, Set<ArgumentRef> candidate) {
        for (ArgumentRef node : excluded) {
            if (isDefendedBy(af, node, candidate)) {
                return false;
            }
        }
        return true;
    }

    private boolean compatible(ArgumentationFramework af, ArgumentRef node, Set<ArgumentRef> candidate) {
        if (af.attacks(node, node)) {
            return false;
        }
        for (ArgumentRef target : af.attackedBy(node)) {
            if (candidate.contains(target)) return false;
        }
        for (ArgumentRef attacker : af.attackersOf(node)) {
            if (candidate.contains(attacker)) return false;
        }
        return true;
    }
}
