package com.stratum.core.port;

/**
 * The external code-transformation service used by the conversion pipeline.
 */
public interface TransformationPort {

    /**
     * Transforms a parent's code whose child spans are placeholder markers. The result
     * must keep one {@code <startLine>: ...code...} marker per child slot.
     */
    String transformSkeleton(String placeholderCode, String locale);

    /**
     * Transforms a self-contained fragment.
     *
     * @param code           numbered source of the fragment
     * @param parentSkeleton transformed skeleton of the enclosing parent, or empty at top level
     */
    String transformFragment(String code, String parentSkeleton, String locale);
}
