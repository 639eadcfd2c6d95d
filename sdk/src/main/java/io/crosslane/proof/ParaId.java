package io.crosslane.proof;

// Id of a parachain within its relay chain.
public final class ParaId {
    private final int id;

    public ParaId(int id) {
        if (id < 0)
            throw new IllegalArgumentException(String.format("Parachain id can not be negative: `%d`", id));
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParaId)) return false;
        return id == ((ParaId) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "ParaId{" + id + "}";
    }
}
