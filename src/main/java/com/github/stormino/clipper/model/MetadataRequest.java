package com.github.stormino.clipper.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataRequest {

    @NotBlank
    @Size(max = 2048)
    private String url;

    @Size(max = 128)
    private String clientId;
}
