package io.surfworks.wavesplit.core.constraint;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Ordered collection of the constraints of one kernel.
 */
public final class ConstraintSet implements Iterable<Constraint> {

    private final List<Constraint> constraints;

    public ConstraintSet(List<? extends Constraint> constraints) {
        this.constraints = List.copyOf(constraints);
    }

    public static ConstraintSet of(Constraint... constraints) {
        return new ConstraintSet(List.of(constraints));
    }

    public List<Constraint> all() {
        return constraints;
    }

    @Override
    public Iterator<Constraint> iterator() {
        return constraints.iterator();
    }

    public int size() {
        return constraints.size();
    }

    public List<WorkgroupConstraint> workgroupConstraints() {
        return ofType(WorkgroupConstraint.class);
    }

    public List<TilingConstraint> tilingConstraints() {
        return ofType(TilingConstraint.class);
    }

    public List<WaveConstraint> waveConstraints() {
        return ofType(WaveConstraint.class);
    }

    public List<HardwareConstraint> hardwareConstraints() {
        return ofType(HardwareConstraint.class);
    }

    public List<SymbolicAlias> symbolicAliases() {
        return ofType(SymbolicAlias.class);
    }

    /**
     * Returns the single hardware constraint.
     *
     * @throws ConfigurationException unless exactly one hardware constraint is present
     */
    public HardwareConstraint hardwareConstraint() {
        List<HardwareConstraint> hardware = hardwareConstraints();
        if (hardware.size() != 1) {
            throw new ConfigurationException("hardware",
                    "Exactly one hardware constraint must be provided, got " + hardware.size());
        }
        return hardware.get(0);
    }

    /**
     * Dimensions that are the source of a symbolic alias.
     */
    public List<IndexSymbol> aliasedDims() {
        List<IndexSymbol> dims = new ArrayList<>();
        for (SymbolicAlias alias : symbolicAliases()) {
            dims.add(alias.source());
        }
        return dims;
    }

    private <T extends Constraint> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Constraint c : constraints) {
            if (type.isInstance(c)) {
                result.add(type.cast(c));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "ConstraintSet" + constraints;
    }
}
