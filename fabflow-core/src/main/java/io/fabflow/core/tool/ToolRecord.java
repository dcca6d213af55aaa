package io.fabflow.core.tool;

import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.optimize.SurrogateModel;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// A manufacturing tool as known to the knowledge store.
///
/// ### Eligibility
/// A tool may run a step only if all of the following hold:
/// - `status` is {@link ToolStatus#AVAILABLE}
/// - `waferSize` matches the step's wafer size
/// - the step's category is among `capableCategories`
/// - none of the step's materials is among `incompatibleMaterials`
///
/// ### Contracts
/// - **Precondition**: `toolId` not blank; `status` and `waferSize` not null
/// - **Postcondition**: all fields immutable after construction
///
/// @param toolId unique tool identifier, not null or blank
/// @param status operational status, not null
/// @param waferSize wafer diameter the chamber accepts, not null
/// @param capableCategories process categories the tool can run, never null after construction
/// @param incompatibleMaterials materials the tool must never process, never null after
///     construction
/// @param surrogateModel response model for this tool, may be null for lithography-only tools
/// @see #isEligibleFor(ProcessCategory, WaferSize, Collection)
public record ToolRecord(
        String toolId,
        ToolStatus status,
        WaferSize waferSize,
        Set<ProcessCategory> capableCategories,
        Set<String> incompatibleMaterials,
        SurrogateModel surrogateModel) {

    public ToolRecord {
        Objects.requireNonNull(toolId, "toolId must not be null");
        if (toolId.isBlank()) {
            throw new IllegalArgumentException("toolId must not be blank");
        }
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(waferSize, "waferSize must not be null");
        capableCategories =
                capableCategories == null || capableCategories.isEmpty()
                        ? Set.of()
                        : Set.copyOf(EnumSet.copyOf(capableCategories));
        incompatibleMaterials =
                incompatibleMaterials != null ? Set.copyOf(incompatibleMaterials) : Set.of();
    }

    /// Evaluates the hard eligibility constraints for a step.
    ///
    /// @param category the step's process category, not null
    /// @param stepWaferSize the step's wafer size, not null
    /// @param materials every material the step touches or that is present on the wafer, not
    ///     null
    /// @return `true` if the tool may run the step
    public boolean isEligibleFor(
            ProcessCategory category, WaferSize stepWaferSize, Collection<String> materials) {
        if (status != ToolStatus.AVAILABLE) {
            return false;
        }
        if (waferSize != stepWaferSize) {
            return false;
        }
        if (!capableCategories.contains(category)) {
            return false;
        }
        for (String material : materials) {
            if (incompatibleMaterials.contains(material)) {
                return false;
            }
        }
        return true;
    }

    /// Returns a copy with a different status.
    ///
    /// @param newStatus the new status, not null
    /// @return new record, never null
    public ToolRecord withStatus(ToolStatus newStatus) {
        return new ToolRecord(
                toolId, newStatus, waferSize, capableCategories, incompatibleMaterials, surrogateModel);
    }

    @Override
    public String toString() {
        return "ToolRecord[" + toolId + ", " + status + ", " + waferSize + ", "
                + capableCategories + "]";
    }
}
