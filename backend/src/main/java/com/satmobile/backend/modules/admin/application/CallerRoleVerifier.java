package com.satmobile.backend.modules.admin.application;

import com.satmobile.backend.global.error.ProblemException;
import com.satmobile.backend.modules.tenant.domain.AdminProfile;
import com.satmobile.backend.modules.tenant.infrastructure.AdminProfileRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Role check for administrative operations. Authentication happens upstream; this only
 * looks up the caller's profile.
 */
@Component
public class CallerRoleVerifier {

    private final AdminProfileRepository profileRepository;

    public CallerRoleVerifier(AdminProfileRepository profileRepository) {
        this.profileRepository = profileRepository;
    }

    public AdminProfile requireAdministrator(String callerId) {
        if (callerId == null || callerId.isBlank()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.caller_missing", "caller id header is required");
        }
        AdminProfile caller = profileRepository.findById(callerId.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.FORBIDDEN, "admin.forbidden", "caller has no profile"));
        if (!caller.isAdministrator() && !caller.isSuperAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "admin.forbidden", "caller is not an administrator");
        }
        return caller;
    }
}
