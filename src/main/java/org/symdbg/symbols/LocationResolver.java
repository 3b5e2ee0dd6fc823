package org.symdbg.symbols;

import java.util.List;

/** Something that can turn an {@link InputLocation} into locations: a process's or a target's symbols. */
public interface LocationResolver {
    List<Location> resolveInputLocation(InputLocation input, ResolveOptions options);
}
