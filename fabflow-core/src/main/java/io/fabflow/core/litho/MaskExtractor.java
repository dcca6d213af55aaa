package io.fabflow.core.litho;

/// Collaborator turning a layout reference into a mask file for one lithography step.
///
/// Implementations typically read a GDS layout, isolate the layer belonging to the step and
/// write it out as its own mask file.
@FunctionalInterface
public interface MaskExtractor {

    /// Extracts the mask for a lithography step.
    ///
    /// @param layoutReference reference to the full layout, not null
    /// @param stepIdentifier lithography step identifier, not null
    /// @return reference to the produced mask file, never null or blank
    /// @throws MaskServiceUnavailableException if the mask service cannot be reached
    String extractMask(String layoutReference, String stepIdentifier)
            throws MaskServiceUnavailableException;
}
