package org.structura.runtime.validation;

import org.structura.runtime.model.BoundaryMarkers.ListMarkers;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Invariants of singly and doubly linked lists.
 * <p>
 * Links are identifiers into the element mapping, so pointer validity is a lookup, and cycle and
 * leak detection are a single bounded walk from head: the walk takes at most
 * {@code max(size, stored elements) + 1} hops and also stops on the first revisited node.
 * Circular lists are not a supported variant; any cycle is a violation.
 */
public class LinkedListInvariants implements IInvariantChecker {

    private final boolean doubly;

    /**
     * @param variant {@link StructureVariant#SINGLY_LINKED} or {@link StructureVariant#DOUBLY_LINKED}.
     */
    public LinkedListInvariants(StructureVariant variant) {
        if (!variant.isLinked()) {
            throw new IllegalArgumentException("Not a list variant: " + variant);
        }
        this.doubly = variant == StructureVariant.DOUBLY_LINKED;
    }

    @Override
    public void check(StateGraph candidate, List<StructuralViolation> violations) {
        if (!(candidate.markers() instanceof ListMarkers markers)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_BOUNDARIES_VALID,
                    "list carries " + candidate.markers().getClass().getSimpleName()));
            return;
        }
        checkBoundaries(candidate, markers, violations);
        checkLinks(candidate, violations);
        Set<ElementId> reachable = walkFromHead(candidate, markers, violations);
        checkOrphans(candidate, reachable, violations);
        if (doubly) {
            checkSymmetry(candidate, markers, violations);
        }
        Integer capacity = candidate.capacity();
        if (capacity != null && candidate.size() > capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.LIST_WITHIN_CAPACITY,
                    candidate.size() + " nodes exceed capacity " + capacity));
        }
    }

    private void checkBoundaries(StateGraph candidate, ListMarkers markers, List<StructuralViolation> violations) {
        ElementId head = markers.head();
        ElementId tail = markers.tail();
        if (head != null && !candidate.contains(head)) {
            violations.add(StructuralViolation.of(ViolationKind.POINTER, InvariantName.LIST_BOUNDARIES_VALID,
                    "head names missing node " + head, head));
        }
        if (tail != null && !candidate.contains(tail)) {
            violations.add(StructuralViolation.of(ViolationKind.POINTER, InvariantName.LIST_BOUNDARIES_VALID,
                    "tail names missing node " + tail, tail));
        }
        if ((head == null) != (tail == null)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_BOUNDARIES_VALID,
                    "only one of head/tail is set", head, tail));
        }
        if (markers.size() < 0 || (head == null && markers.size() != 0)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_SIZE_MATCHES_TRAVERSAL,
                    "size " + markers.size() + " does not fit head " + head));
        }
    }

    private void checkLinks(StateGraph candidate, List<StructuralViolation> violations) {
        for (Element e : candidate.elements().values()) {
            if (e.next() != null && !candidate.contains(e.next())) {
                violations.add(StructuralViolation.of(ViolationKind.POINTER, InvariantName.LIST_LINKS_VALID,
                        e.id() + ".next names missing node " + e.next(), e.id()));
            }
            if (e.prev() != null) {
                if (!doubly) {
                    violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_LINKS_VALID,
                            e.id() + " carries a prev link in a singly linked list", e.id()));
                } else if (!candidate.contains(e.prev())) {
                    violations.add(StructuralViolation.of(ViolationKind.POINTER, InvariantName.LIST_LINKS_VALID,
                            e.id() + ".prev names missing node " + e.prev(), e.id()));
                }
            }
        }
    }

    /**
     * Walks the next chain from head.
     *
     * @return the nodes visited, in order.
     */
    private Set<ElementId> walkFromHead(StateGraph candidate, ListMarkers markers, List<StructuralViolation> violations) {
        Set<ElementId> visited = new LinkedHashSet<>();
        int bound = Math.max(markers.size(), candidate.size()) + 1;
        ElementId previous = null;
        ElementId cursor = markers.head();
        int hops = 0;
        boolean cyclic = false;

        while (cursor != null && candidate.contains(cursor)) {
            if (!visited.add(cursor) || ++hops > bound) {
                violations.add(StructuralViolation.of(ViolationKind.CYCLE, InvariantName.LIST_ACYCLIC,
                        "traversal from head re-enters " + cursor + " via " + previous, previous, cursor));
                cyclic = true;
                break;
            }
            previous = cursor;
            cursor = candidate.element(cursor).next();
        }
        if (cyclic || cursor != null) {
            // a dangling link was already reported by checkLinks
            return visited;
        }

        if (visited.size() != markers.size()) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_SIZE_MATCHES_TRAVERSAL,
                    "traversal visits " + visited.size() + " nodes but size is " + markers.size()));
        }
        if (markers.tail() != null && previous != null && !previous.equals(markers.tail())) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.LIST_SIZE_MATCHES_TRAVERSAL,
                    "traversal ends at " + previous + " but tail is " + markers.tail(), previous, markers.tail()));
        }
        return visited;
    }

    private void checkOrphans(StateGraph candidate, Set<ElementId> reachable, List<StructuralViolation> violations) {
        List<ElementId> orphans = candidate.elements().keySet().stream()
                .filter(id -> !reachable.contains(id))
                .collect(Collectors.toList());
        if (!orphans.isEmpty()) {
            violations.add(StructuralViolation.of(ViolationKind.LEAK, InvariantName.LIST_NO_ORPHANS,
                    orphans.size() + " node(s) unreachable from head", orphans));
        }
    }

    private void checkSymmetry(StateGraph candidate, ListMarkers markers, List<StructuralViolation> violations) {
        for (Element n : candidate.elements().values()) {
            Element m = candidate.element(n.next());
            if (m != null && !n.id().equals(m.prev())) {
                violations.add(StructuralViolation.of(ViolationKind.SYMMETRY, InvariantName.DLIST_LINK_SYMMETRY,
                        n.id() + ".next = " + m.id() + " but " + m.id() + ".prev = " + m.prev(), n.id(), m.id()));
            }
            Element p = candidate.element(n.prev());
            if (p != null && !n.id().equals(p.next())) {
                violations.add(StructuralViolation.of(ViolationKind.SYMMETRY, InvariantName.DLIST_LINK_SYMMETRY,
                        n.id() + ".prev = " + p.id() + " but " + p.id() + ".next = " + p.next(), n.id(), p.id()));
            }
        }
        Element head = candidate.element(markers.head());
        if (head != null && head.prev() != null) {
            violations.add(StructuralViolation.of(ViolationKind.SYMMETRY, InvariantName.DLIST_LINK_SYMMETRY,
                    "head " + head.id() + " has prev " + head.prev(), head.id()));
        }
    }

    @Override
    public InvariantName overflowInvariant() {
        return InvariantName.LIST_WITHIN_CAPACITY;
    }

    @Override
    public InvariantName underflowInvariant() {
        return InvariantName.POSITION_IN_RANGE;
    }
}
