package se.fishmarket_be.service;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.fishmarket_be.configuration.JWTTokenUtil;
import se.fishmarket_be.dto.request.LoginRequest;
import se.fishmarket_be.dto.request.RegisterRequest;
import se.fishmarket_be.dto.request.UpdateUserRequest;
import se.fishmarket_be.dto.response.AuthResponse;
import se.fishmarket_be.dto.response.UserResponse;
import se.fishmarket_be.exception.AccountInactiveException;
import se.fishmarket_be.exception.DuplicateResourceException;
import se.fishmarket_be.exception.InvalidCredentialsException;
import se.fishmarket_be.exception.InvalidTokenException;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.exception.UnauthorizedException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.repository.UserRepository;
import se.fishmarket_be.util.PaginationUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JWTTokenUtil jwtTokenUtil;
    private final ModelMapper modelMapper;

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (userRepository.existsByEmail(email)) {
            log.warn("register: email {} already registered", email);
            throw new DuplicateResourceException("Email '" + email + "' is already registered");
        }

        User user = User.builder()
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .fullName(request.getFullName().trim())
                .phone(request.getPhone())
                .boostCredits(0)
                .isAdmin(false)
                .isActive(true)
                .build();
        User saved = userRepository.save(user);
        log.info("User {} registered with id {}", email, saved.getUserId());
        return toAuthResponse(saved);
    }

    public AuthResponse login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());
        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null || !passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.warn("login: invalid credentials for {}", email);
            throw new InvalidCredentialsException("Invalid email or password");
        }
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("login: account {} is deactivated", user.getUserId());
            throw new AccountInactiveException("Account is deactivated");
        }
        log.info("User {} logged in", user.getUserId());
        return toAuthResponse(user);
    }

    /**
     * Resolves the account behind a bearer token.
     */
    public UserResponse getCurrentUser(String token) {
        String email;
        try {
            email = jwtTokenUtil.extractUsername(token);
        } catch (ExpiredJwtException e) {
            log.warn("getCurrentUser: token expired at {}", e.getClaims().getExpiration());
            throw new InvalidTokenException("Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("getCurrentUser: token rejected: {}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }
        if (email == null) {
            throw new InvalidTokenException("Invalid token");
        }

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("User not found with email: " + email));
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("getCurrentUser: account {} is deactivated", user.getUserId());
            throw new AccountInactiveException("Account is deactivated");
        }
        return modelMapper.toUserResponse(user);
    }

    public User findByEmail(String email) {
        return userRepository.findByEmail(normalizeEmail(email))
                .orElseThrow(() -> new ResourceNotFoundException("User not found with email: " + email));
    }

    public User findById(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found with ID: " + userId));
    }

    public List<UserResponse> getUsers(String search, Boolean isAdmin, Boolean isActive, Integer limit, Integer offset) {
        Specification<User> spec = Specification.where(null);
        if (PaginationUtils.hasText(search)) spec = spec.and(matchesSearch(search));
        if (isAdmin != null) spec = spec.and((root, query, cb) -> cb.equal(root.get("isAdmin"), isAdmin));
        if (isActive != null) spec = spec.and((root, query, cb) -> cb.equal(root.get("isActive"), isActive));

        Pageable pageable = PaginationUtils.createPageable(limit, offset,
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "userId")));
        return userRepository.findAll(spec, pageable).stream()
                .map(modelMapper::toUserResponse)
                .toList();
    }

    public Optional<UserResponse> getUserById(Long userId) {
        return userRepository.findById(userId).map(modelMapper::toUserResponse);
    }

    @Transactional
    public UserResponse updateUser(Long userId, UpdateUserRequest request, User requester) {
        if (!requester.getUserId().equals(userId) && !Boolean.TRUE.equals(requester.getIsAdmin())) {
            log.warn("updateUser: user {} may not update user {}", requester.getUserId(), userId);
            throw new UnauthorizedException("You can only update your own profile");
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("updateUser: user {} not found", userId);
                    return new ResourceNotFoundException("User not found with ID: " + userId);
                });

        if (request.hasFullName()) user.setFullName(request.getFullName().trim());
        if (request.hasPhone()) user.setPhone(request.getPhone());
        if (request.hasAvatarUrl()) user.setAvatarUrl(request.getAvatarUrl());

        User saved = userRepository.save(user);
        log.info("User {} updated by {}", userId, requester.getUserId());
        return modelMapper.toUserResponse(saved);
    }

    @Transactional
    public boolean deactivateUser(Long userId) {
        return setActive(userId, false);
    }

    @Transactional
    public boolean activateUser(Long userId) {
        return setActive(userId, true);
    }

    private boolean setActive(Long userId, boolean active) {
        Optional<User> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            log.warn("setActive: user {} not found", userId);
            return false;
        }
        User user = found.get();
        if (!Boolean.valueOf(active).equals(user.getIsActive())) {
            user.setIsActive(active);
            userRepository.save(user);
            log.info("User {} {}", userId, active ? "activated" : "deactivated");
        }
        return true;
    }

    private Specification<User> matchesSearch(String search) {
        return (root, query, cb) -> {
            String pattern = PaginationUtils.likePattern(search);
            return cb.or(
                    cb.like(cb.lower(root.get("email")), pattern, '\\'),
                    cb.like(cb.lower(root.get("fullName")), pattern, '\\')
            );
        };
    }

    private AuthResponse toAuthResponse(User user) {
        return AuthResponse.builder()
                .user(modelMapper.toUserResponse(user))
                .token(jwtTokenUtil.generateToken(user))
                .expiresIn(jwtTokenUtil.getExpirationSeconds())
                .build();
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
