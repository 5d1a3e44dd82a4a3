package com.satmobile.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.Size;

public record CrossCategorySyncRequest(
        @Size(max = 120) String categoryLabel
) {
}
