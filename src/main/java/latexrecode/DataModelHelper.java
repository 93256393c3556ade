package latexrecode;

import java.util.*;

/**
 * The parts of the bibliography data model the decoder needs: names of the fields
 * and lists whose values are verbatim and must never be macro-rewritten
 * (for example {@code url}, {@code doi}, {@code file}).
 */
public final class DataModelHelper {
    private final List<String> verbatimFields;
    private final List<String> verbatimLists;

    /**
     * @param verbatimFields names of verbatim fields
     * @param verbatimLists  names of verbatim lists
     */
    public DataModelHelper(Collection<String> verbatimFields, Collection<String> verbatimLists) {
        this.verbatimFields = copy(verbatimFields);
        this.verbatimLists = copy(verbatimLists);
    }

    private static List<String> copy(Collection<String> names) {
        if (names == null) return Collections.emptyList();
        List<String> out = new ArrayList<>(names.size());
        for (String n : names) {
            if (n != null && !n.trim().isEmpty()) out.add(n.trim());
        }
        return Collections.unmodifiableList(out);
    }

    public List<String> getVerbatimFields() {
        return verbatimFields;
    }

    public List<String> getVerbatimLists() {
        return verbatimLists;
    }

    /**
     * Returns verbatim field names followed by verbatim list names, without duplicates.
     *
     * @return all protected names
     */
    public Set<String> verbatimNames() {
        Set<String> all = new LinkedHashSet<>(verbatimFields);
        all.addAll(verbatimLists);
        return all;
    }

    @Override
    public String toString() {
        return "<DataModelHelper vfields=" + verbatimFields + " vlists=" + verbatimLists + ">";
    }
}
