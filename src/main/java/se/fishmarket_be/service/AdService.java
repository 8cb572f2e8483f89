package se.fishmarket_be.service;

import jakarta.persistence.criteria.Expression;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.fishmarket_be.dto.request.AdCreateRequest;
import se.fishmarket_be.dto.request.AdFilterRequest;
import se.fishmarket_be.dto.request.AdUpdateRequest;
import se.fishmarket_be.dto.request.BoostAdRequest;
import se.fishmarket_be.dto.request.ModerateAdRequest;
import se.fishmarket_be.dto.response.AdResponse;
import se.fishmarket_be.exception.BusinessLogicException;
import se.fishmarket_be.exception.InsufficientCreditsException;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.exception.UnauthorizedException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.Ad;
import se.fishmarket_be.pojo.Category;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.pojo.enums.AdStatus;
import se.fishmarket_be.repository.AdRepository;
import se.fishmarket_be.repository.CategoryRepository;
import se.fishmarket_be.repository.UserRepository;
import se.fishmarket_be.util.PaginationUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class AdService {

    /** Credits charged per boost call, whatever the requested duration. */
    public static final int BOOST_COST = 1;

    private static final Set<AdStatus> MODERATABLE = EnumSet.of(AdStatus.DRAFT, AdStatus.ACTIVE, AdStatus.REJECTED);

    private final AdRepository adRepository;
    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final ModelMapper modelMapper;

    /**
     * Public listing: active ads only, effectively boosted ads first, newest first within each group.
     */
    public List<AdResponse> getAds(AdFilterRequest filter) {
        Specification<Ad> spec = buildFilterSpecification(filter)
                .and(hasStatus(AdStatus.ACTIVE))
                .and(boostedFirst(LocalDateTime.now()));
        return modelMapper.toAdResponses(
                adRepository.findAll(spec, PaginationUtils.createPageable(filter.getLimit(), filter.getOffset())).getContent());
    }

    /**
     * Moderation queue: any status, optionally narrowed to one.
     */
    public List<AdResponse> getAllAds(AdFilterRequest filter) {
        Specification<Ad> spec = buildFilterSpecification(filter);
        if (filter.getStatus() != null) spec = spec.and(hasStatus(filter.getStatus()));
        spec = spec.and(boostedFirst(LocalDateTime.now()));
        return modelMapper.toAdResponses(
                adRepository.findAll(spec, PaginationUtils.createPageable(filter.getLimit(), filter.getOffset())).getContent());
    }

    /**
     * Every successful read counts as a view; the returned ad already carries the bumped counter.
     */
    @Transactional
    public Optional<AdResponse> getAdById(Long adId) {
        if (adRepository.incrementViewCount(adId) == 0) {
            log.debug("getAdById: ad {} not found", adId);
            return Optional.empty();
        }
        return adRepository.findByIdWithRelations(adId).map(modelMapper::toAdResponse);
    }

    public List<AdResponse> getUserAds(Long userId) {
        return modelMapper.toAdResponses(adRepository.findByUserUserIdOrderByCreatedAtDesc(userId));
    }

    @Transactional
    public AdResponse createAd(AdCreateRequest request, Long ownerId) {
        User owner = userRepository.findById(ownerId)
                .orElseThrow(() -> {
                    log.warn("createAd: owner {} not found", ownerId);
                    return new ResourceNotFoundException("User not found with ID: " + ownerId);
                });
        Category category = findUsableCategory(request.getCategoryId(), "createAd");

        Ad ad = Ad.builder()
                .user(owner)
                .category(category)
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .price(normalizePrice(request.getPrice()))
                .location(request.getLocation().trim())
                .contactInfo(request.getContactInfo().trim())
                .images(copyImages(request.getImages()))
                .isBoosted(false)
                .boostExpiresAt(null)
                .viewCount(0)
                .contactCount(0)
                .status(AdStatus.DRAFT)
                .build();

        Ad saved = adRepository.save(ad);
        log.info("User {} created ad {} in category {}", ownerId, saved.getAdId(), category.getCategoryId());
        return modelMapper.toAdResponse(saved);
    }

    @Transactional
    public AdResponse updateAd(Long adId, AdUpdateRequest request, Long requesterId) {
        Ad ad = adRepository.findById(adId)
                .orElseThrow(() -> {
                    log.warn("updateAd: ad {} not found", adId);
                    return new ResourceNotFoundException("Ad not found with ID: " + adId);
                });
        requireOwner(ad, requesterId, "updateAd");
        requireNotDeleted(ad, "updateAd");

        if (request.hasCategoryId()) ad.setCategory(findUsableCategory(request.getCategoryId(), "updateAd"));
        if (request.hasTitle()) ad.setTitle(request.getTitle().trim());
        if (request.hasDescription()) ad.setDescription(request.getDescription());
        if (request.hasPrice()) ad.setPrice(normalizePrice(request.getPrice()));
        if (request.hasLocation()) ad.setLocation(request.getLocation().trim());
        if (request.hasContactInfo()) ad.setContactInfo(request.getContactInfo().trim());
        if (request.hasImages()) {
            ad.getImages().clear();
            ad.getImages().addAll(copyImages(request.getImages()));
        }
        // bump even when nothing changed
        ad.setUpdatedAt(LocalDateTime.now());

        Ad saved = adRepository.save(ad);
        log.info("User {} updated ad {}", requesterId, adId);
        return modelMapper.toAdResponse(saved);
    }

    /**
     * Soft delete by the owner or an admin. Deleting an already deleted ad succeeds without changes.
     */
    @Transactional
    public boolean deleteAd(Long adId, User requester) {
        Ad ad = adRepository.findById(adId)
                .orElseThrow(() -> {
                    log.warn("deleteAd: ad {} not found", adId);
                    return new ResourceNotFoundException("Ad not found with ID: " + adId);
                });
        boolean isAdmin = Boolean.TRUE.equals(requester.getIsAdmin());
        if (!isAdmin) {
            requireOwner(ad, requester.getUserId(), "deleteAd");
        }
        if (ad.getStatus() == AdStatus.DELETED) {
            return true;
        }

        ad.setStatus(AdStatus.DELETED);
        ad.setUpdatedAt(LocalDateTime.now());
        adRepository.save(ad);
        log.info("Ad {} deleted by {}{}", adId, requester.getUserId(), isAdmin ? " (admin)" : "");
        return true;
    }

    /**
     * Charges {@link #BOOST_COST} credit and boosts the ad until now + durationDays, in one transaction.
     * The ad row stays locked for the whole operation and the debit only succeeds while the balance covers it.
     */
    @Transactional
    public AdResponse boostAd(Long adId, BoostAdRequest request, Long requesterId) {
        Ad ad = adRepository.findByIdForUpdate(adId)
                .orElseThrow(() -> {
                    log.warn("boostAd: ad {} not found", adId);
                    return new ResourceNotFoundException("Ad not found with ID: " + adId);
                });
        requireOwner(ad, requesterId, "boostAd");
        requireNotDeleted(ad, "boostAd");

        if (userRepository.debitBoostCredits(requesterId, BOOST_COST) == 0) {
            log.warn("boostAd: user {} has fewer than {} boost credits for ad {}", requesterId, BOOST_COST, adId);
            throw new InsufficientCreditsException(requesterId, BOOST_COST);
        }

        // the debit cleared the persistence context
        Ad locked = adRepository.findByIdForUpdate(adId)
                .orElseThrow(() -> new ResourceNotFoundException("Ad not found with ID: " + adId));
        LocalDateTime now = LocalDateTime.now();
        locked.setIsBoosted(true);
        locked.setBoostExpiresAt(now.plusDays(request.getDurationDays()));
        locked.setUpdatedAt(now);

        Ad saved = adRepository.save(locked);
        log.info("User {} boosted ad {} for {} days, until {}", requesterId, adId,
                request.getDurationDays(), saved.getBoostExpiresAt());
        return modelMapper.toAdResponse(saved);
    }

    @Transactional
    public AdResponse moderateAd(Long adId, ModerateAdRequest request) {
        AdStatus target = request.getStatus();
        if (target != AdStatus.ACTIVE && target != AdStatus.REJECTED) {
            throw new BusinessLogicException("Moderation status must be ACTIVE or REJECTED");
        }
        Ad ad = adRepository.findByIdForUpdate(adId)
                .orElseThrow(() -> {
                    log.warn("moderateAd: ad {} not found", adId);
                    return new ResourceNotFoundException("Ad not found with ID: " + adId);
                });
        if (!MODERATABLE.contains(ad.getStatus())) {
            log.warn("moderateAd: ad {} is {} and cannot be moderated", adId, ad.getStatus());
            throw new BusinessLogicException("Ad with status " + ad.getStatus() + " cannot be moderated");
        }

        ad.setStatus(target);
        if (request.getRejectionReason() != null) {
            ad.setRejectionReason(request.getRejectionReason());
        } else if (target == AdStatus.ACTIVE) {
            ad.setRejectionReason(null);
        }
        ad.setUpdatedAt(LocalDateTime.now());

        Ad saved = adRepository.save(ad);
        log.info("Ad {} moderated to {}", adId, target);
        return modelMapper.toAdResponse(saved);
    }

    @Transactional
    public boolean incrementContactCount(Long adId) {
        if (adRepository.incrementContactCount(adId) == 0) {
            log.warn("incrementContactCount: ad {} not found", adId);
            throw new ResourceNotFoundException("Ad not found with ID: " + adId);
        }
        return true;
    }

    private Category findUsableCategory(Long categoryId, String operation) {
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> {
                    log.warn("{}: category {} not found", operation, categoryId);
                    return new ResourceNotFoundException("Category not found with ID: " + categoryId);
                });
        if (!category.isActive()) {
            log.warn("{}: category {} is inactive", operation, categoryId);
            throw new BusinessLogicException("Category " + categoryId + " is no longer active");
        }
        return category;
    }

    private void requireOwner(Ad ad, Long requesterId, String operation) {
        if (!ad.getUser().getUserId().equals(requesterId)) {
            log.warn("{}: user {} does not own ad {}", operation, requesterId, ad.getAdId());
            throw new UnauthorizedException("You can only modify your own ads");
        }
    }

    private void requireNotDeleted(Ad ad, String operation) {
        if (ad.getStatus() == AdStatus.DELETED) {
            log.warn("{}: ad {} is deleted", operation, ad.getAdId());
            throw new BusinessLogicException("Ad " + ad.getAdId() + " has been deleted");
        }
    }

    private static BigDecimal normalizePrice(BigDecimal price) {
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    private static List<String> copyImages(List<String> images) {
        if (images == null) return new ArrayList<>();
        if (images.size() > Ad.MAX_IMAGES) {
            throw new BusinessLogicException("An ad can have at most " + Ad.MAX_IMAGES + " images");
        }
        return new ArrayList<>(images);
    }

    private Specification<Ad> buildFilterSpecification(AdFilterRequest filter) {
        Specification<Ad> spec = Specification.where(null);

        if (filter.getCategoryId() != null) spec = spec.and(hasCategoryId(filter.getCategoryId()));
        if (filter.getUserId() != null) spec = spec.and(hasOwnerId(filter.getUserId()));
        if (PaginationUtils.hasText(filter.getSearch())) spec = spec.and(hasSearch(filter.getSearch()));
        if (PaginationUtils.hasText(filter.getLocation())) spec = spec.and(hasLocation(filter.getLocation()));
        if (filter.getMinPrice() != null) spec = spec.and(hasMinPrice(filter.getMinPrice()));
        if (filter.getMaxPrice() != null) spec = spec.and(hasMaxPrice(filter.getMaxPrice()));

        return spec;
    }

    private Specification<Ad> hasStatus(AdStatus status) {
        return (root, query, criteriaBuilder) -> criteriaBuilder.equal(root.get("status"), status);
    }

    private Specification<Ad> hasCategoryId(Long categoryId) {
        return (root, query, criteriaBuilder) -> criteriaBuilder.equal(root.get("category").get("categoryId"), categoryId);
    }

    private Specification<Ad> hasOwnerId(Long userId) {
        return (root, query, criteriaBuilder) -> criteriaBuilder.equal(root.get("user").get("userId"), userId);
    }

    private Specification<Ad> hasSearch(String search) {
        return (root, query, criteriaBuilder) -> {
            String likePattern = PaginationUtils.likePattern(search);
            return criteriaBuilder.or(
                    criteriaBuilder.like(criteriaBuilder.lower(root.get("title")), likePattern, '\\'),
                    criteriaBuilder.like(criteriaBuilder.lower(root.get("description")), likePattern, '\\')
            );
        };
    }

    private Specification<Ad> hasLocation(String location) {
        return (root, query, criteriaBuilder) ->
                criteriaBuilder.like(criteriaBuilder.lower(root.get("location")), PaginationUtils.likePattern(location), '\\');
    }

    private Specification<Ad> hasMinPrice(BigDecimal minPrice) {
        return (root, query, criteriaBuilder) -> criteriaBuilder.greaterThanOrEqualTo(root.get("price"), minPrice);
    }

    private Specification<Ad> hasMaxPrice(BigDecimal maxPrice) {
        return (root, query, criteriaBuilder) -> criteriaBuilder.lessThanOrEqualTo(root.get("price"), maxPrice);
    }

    /**
     * Contributes ordering only. Count queries are left unordered.
     */
    private Specification<Ad> boostedFirst(LocalDateTime now) {
        return (root, query, criteriaBuilder) -> {
            Class<?> resultType = query.getResultType();
            if (resultType != Long.class && resultType != long.class) {
                Expression<Integer> boostRank = criteriaBuilder.<Integer>selectCase()
                        .when(criteriaBuilder.and(
                                criteriaBuilder.isTrue(root.<Boolean>get("isBoosted")),
                                criteriaBuilder.greaterThan(root.<LocalDateTime>get("boostExpiresAt"), now)), 0)
                        .otherwise(1);
                query.orderBy(
                        criteriaBuilder.asc(boostRank),
                        criteriaBuilder.desc(root.get("createdAt")),
                        criteriaBuilder.desc(root.get("adId")));
            }
            return null;
        };
    }
}
