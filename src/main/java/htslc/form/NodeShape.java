// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.form;

import java.util.List;
import htslc.util.annotation.Nullable;

/**
 * The items following a markup node's element token, split into the optional property map and the children.
 */
public record NodeShape(@Nullable Form.Properties properties, List<Form> children) {
    public NodeShape {
        children = List.copyOf(children);
    }

    /**
     * Analyzes the given trailing items: if the first one is a {@link Form.Properties} it's taken as the property map
     * and the children start right after it, otherwise there are no properties and every item is a child.
     */
    public static NodeShape of(final List<Form> trailing) {
        if (!trailing.isEmpty() && trailing.get(0) instanceof Form.Properties properties) {
            return new NodeShape(properties, trailing.subList(1, trailing.size()));
        }
        return new NodeShape(null, trailing);
    }
}
