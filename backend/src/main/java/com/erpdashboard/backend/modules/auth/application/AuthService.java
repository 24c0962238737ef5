package com.erpdashboard.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.erpdashboard.backend.modules.auth.domain.ErpUser;
import com.erpdashboard.backend.modules.auth.domain.UserRoleCode;
import com.erpdashboard.backend.modules.auth.domain.UserStatus;
import com.erpdashboard.backend.modules.auth.infrastructure.persistence.ErpUserRepository;
import com.erpdashboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.erpdashboard.backend.modules.auth.presentation.dto.LoginResponse;
import com.erpdashboard.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.erpdashboard.backend.modules.branch.application.BranchService;
import com.erpdashboard.backend.modules.branch.domain.Branch;
import com.erpdashboard.backend.modules.sequence.application.IdentifierService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String MESSAGE_CREATED = "User created and logged in successfully";
    private static final String MESSAGE_LOGGED_IN = "Login successful";

    private final ErpUserRepository erpUserRepository;
    private final BranchService branchService;
    private final IdentifierService identifierService;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            ErpUserRepository erpUserRepository,
            BranchService branchService,
            IdentifierService identifierService,
            JwtTokenService jwtTokenService
    ) {
        this.erpUserRepository = erpUserRepository;
        this.branchService = branchService;
        this.identifierService = identifierService;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * 기존 사용자는 로그인시키고 처음 보는 사용자는 가입시킨다. 신규 계정은 지점의 다음 고유 ID를 받으며,
     * 카운터 증가가 이 트랜잭션을 공유하므로 삽입이 실패해도 번호가 소모되지 않는다.
     */
    public LoginResponse login(LoginRequest request) {
        String email = normalizeEmail(request.email());
        String externalUid = request.firebaseUid().trim();

        Optional<ErpUser> existing = erpUserRepository.findByEmailAndExternalUid(email, externalUid);
        if (existing.isPresent()) {
            ErpUser user = existing.get();
            if (!user.getStatus().canLogin()) {
                throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
            }
            return buildLoginResponse(user, false);
        }

        ErpUser created = signup(email, externalUid, request.displayName(), request.branchId());
        return buildLoginResponse(created, true);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        ErpUser user = erpUserRepository.findWithBranchById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        return buildUserProfile(user);
    }

    private ErpUser signup(String email, String externalUid, String displayName, String branchId) {
        if (displayName == null || displayName.isBlank() || branchId == null || branchId.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "SIGNUP_FIELDS_REQUIRED",
                    "For new users, displayName and branchId are required.");
        }
        if (erpUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "USER_ALREADY_EXISTS",
                    "An account with this email is linked to a different identity");
        }

        Branch branch = branchService.requireActiveBranch(branchId);
        String uniqueId = identifierService.nextUserUniqueId(branch.getBranchCode());

        ErpUser user = new ErpUser();
        user.setUniqueId(uniqueId);
        user.setDisplayName(displayName.trim());
        user.setEmail(email);
        user.setExternalUid(externalUid);
        user.setBranch(branch);
        user.setRole(UserRoleCode.USER);
        user.setStatus(UserStatus.ACTIVE);

        try {
            erpUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "USER_ALREADY_EXISTS",
                    "An account with this email already exists", ex);
        }

        log.info("New user created: {} ({}) in branch {}", uniqueId, user.getDisplayName(), branch.getBranchId());
        return user;
    }

    private LoginResponse buildLoginResponse(ErpUser user, boolean newUser) {
        IssuedToken token = jwtTokenService.issueAccessToken(user);
        return new LoginResponse(
                true,
                newUser,
                newUser ? MESSAGE_CREATED : MESSAGE_LOGGED_IN,
                token.accessToken(),
                token.tokenType(),
                token.expiresIn(),
                buildUserProfile(user)
        );
    }

    private UserProfileResponse buildUserProfile(ErpUser user) {
        Branch branch = user.getBranch();
        return new UserProfileResponse(
                user.getId(),
                user.getUniqueId(),
                user.getDisplayName(),
                user.getEmail(),
                user.getRole().name(),
                branch.getBranchId(),
                branch.getBranchName(),
                branch.getBranchLocation(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private String normalizeEmail(String rawEmail) {
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}
