package se.fishmarket_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.fishmarket_be.dto.request.MembershipPackageRequest;
import se.fishmarket_be.dto.response.MembershipPackageResponse;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.MembershipPackage;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.repository.MembershipPackageRepository;
import se.fishmarket_be.repository.UserRepository;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class MembershipService {

    static final String NOT_FOUND_OR_INACTIVE = "Membership package not found or inactive";

    private final MembershipPackageRepository membershipPackageRepository;
    private final UserRepository userRepository;
    private final ModelMapper modelMapper;

    public List<MembershipPackageResponse> getMembershipPackages() {
        return membershipPackageRepository.findByIsActiveTrueOrderByPriceAsc().stream()
                .map(modelMapper::toMembershipPackageResponse)
                .toList();
    }

    public MembershipPackageResponse getMembershipPackageById(Long id) {
        MembershipPackage membershipPackage = membershipPackageRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Membership package not found with ID: " + id));
        return modelMapper.toMembershipPackageResponse(membershipPackage);
    }

    /**
     * Looks up a package that can still be sold or assigned.
     */
    public MembershipPackage findActivePackage(Long packageId) {
        return membershipPackageRepository.findByPackageIdAndIsActiveTrue(packageId)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_OR_INACTIVE));
    }

    @Transactional
    public MembershipPackageResponse createMembershipPackage(MembershipPackageRequest request) {
        MembershipPackage membershipPackage = MembershipPackage.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .price(request.getPrice().setScale(2, RoundingMode.HALF_UP))
                .durationDays(request.getDurationDays())
                .maxAds(request.getMaxAds())
                .boostCredits(request.hasBoostCredits() ? request.getBoostCredits() : 0)
                .features(request.hasFeatures() ? new ArrayList<>(request.getFeatures()) : new ArrayList<>())
                .isActive(true)
                .build();
        MembershipPackage saved = membershipPackageRepository.save(membershipPackage);
        log.info("Membership package '{}' created with id {}", saved.getName(), saved.getPackageId());
        return modelMapper.toMembershipPackageResponse(saved);
    }

    @Transactional
    public MembershipPackageResponse updateMembershipPackage(Long id, MembershipPackageRequest request) {
        MembershipPackage membershipPackage = membershipPackageRepository.findById(id)
                .orElseThrow(() -> {
                    log.warn("updateMembershipPackage: package {} not found", id);
                    return new ResourceNotFoundException("Membership package not found with ID: " + id);
                });

        if (request.hasName()) membershipPackage.setName(request.getName().trim());
        if (request.hasDescription()) membershipPackage.setDescription(request.getDescription());
        if (request.hasPrice()) membershipPackage.setPrice(request.getPrice().setScale(2, RoundingMode.HALF_UP));
        if (request.hasDurationDays()) membershipPackage.setDurationDays(request.getDurationDays());
        if (request.hasMaxAds()) membershipPackage.setMaxAds(request.getMaxAds());
        if (request.hasBoostCredits()) membershipPackage.setBoostCredits(request.getBoostCredits());
        if (request.hasFeatures()) {
            membershipPackage.getFeatures().clear();
            membershipPackage.getFeatures().addAll(request.getFeatures());
        }

        return modelMapper.toMembershipPackageResponse(membershipPackageRepository.save(membershipPackage));
    }

    @Transactional
    public boolean deactivateMembershipPackage(Long id) {
        Optional<MembershipPackage> found = membershipPackageRepository.findById(id);
        if (found.isEmpty()) {
            log.warn("deactivateMembershipPackage: package {} not found", id);
            return false;
        }
        MembershipPackage membershipPackage = found.get();
        if (membershipPackage.isActive()) {
            membershipPackage.setActive(false);
            membershipPackageRepository.save(membershipPackage);
            log.info("Membership package {} deactivated", id);
        }
        return true;
    }

    /**
     * Admin assignment. Only the membership reference changes; no credits are granted.
     */
    @Transactional
    public boolean assignMembershipToUser(Long userId, Long membershipId) {
        MembershipPackage membershipPackage = membershipPackageRepository.findByPackageIdAndIsActiveTrue(membershipId)
                .orElseThrow(() -> {
                    log.warn("assignMembershipToUser: package {} not found or inactive", membershipId);
                    return new ResourceNotFoundException(NOT_FOUND_OR_INACTIVE);
                });
        User user = userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("assignMembershipToUser: user {} not found", userId);
                    return new ResourceNotFoundException("User not found with ID: " + userId);
                });

        user.setMembership(membershipPackage);
        userRepository.save(user);
        log.info("Membership package {} assigned to user {}", membershipId, userId);
        return true;
    }
}
