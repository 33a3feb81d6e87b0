package com.dailyfin.backend.dto.expense;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationDTO {

    @NotNull(message = "Latitude é obrigatória")
    @DecimalMin(value = "-90") @DecimalMax(value = "90")
    private Double latitude;

    @NotNull(message = "Longitude é obrigatória")
    @DecimalMin(value = "-180") @DecimalMax(value = "180")
    private Double longitude;

    private String address;
}
