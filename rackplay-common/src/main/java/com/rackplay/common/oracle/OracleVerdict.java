package com.rackplay.common.oracle;

import java.util.Set;

public record OracleVerdict(Set<String> valid, Set<String> invalid) {

    public OracleVerdict {
        valid = Set.copyOf(valid);
        invalid = Set.copyOf(invalid);
    }

    public boolean allValid() {
        return this.invalid.isEmpty();
    }
}
