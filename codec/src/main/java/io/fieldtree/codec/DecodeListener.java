package io.fieldtree.codec;

import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.tree.ObjectShape;

import java.util.Map;

/**
 * Receives every object produced by a decode, children before their parent.
 * <p>
 * {@code value} is the live map placed into the result, so a listener may keep it
 * and later add keys to it (the incremental merger grafts deferred fields this way).
 */
@FunctionalInterface
public interface DecodeListener {

    DecodeListener NONE = (path, shape, value) -> { };

    /**
     * @param path  absolute path of the object in the response
     * @param shape flat shape the object was decoded with (the resolved variant when polymorphic)
     */
    void onObject(ResponsePath path, ObjectShape shape, Map<String, Object> value);
}
