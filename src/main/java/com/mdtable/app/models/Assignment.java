package com.mdtable.app.models;

/**
 * Write target on the left side of a formula ("D2 = ...", "D_ = ...", "A1:C3 = ...").
 * Uses the same six shapes and row conventions as {@link CellReference}.
 */
public final class Assignment {
    private final CellReference target;

    public Assignment(CellReference target) {
        this.target = target;
    }

    public CellReference getTarget() {
        return target;
    }

    public CellReference.Kind getKind() {
        return target.getKind();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment && target.equals(((Assignment) o).target);
    }

    @Override
    public int hashCode() {
        return target.hashCode();
    }

    @Override
    public String toString() {
        return target.toText();
    }
}
