package io.fieldtree.core.document;

import java.util.List;

/**
 * One entry of a selection set as parsed: a field, a named fragment spread,
 * or an inline fragment.
 */
public sealed interface Selection permits FieldSelection, FragmentSpread, InlineFragment {

    List<Directive> directives();

    SourceLocation location();
}
