package io.b2mash.prodtrack.jobstatus.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReorderJobStatusesRequest(
    @NotEmpty(message = "statusOrders must not be empty") List<@Valid StatusOrder> statusOrders) {

  public record StatusOrder(@NotNull Long id, @NotNull Integer orderIndex) {}
}
