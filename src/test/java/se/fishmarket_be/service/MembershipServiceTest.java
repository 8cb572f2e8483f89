package se.fishmarket_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import se.fishmarket_be.dto.request.MembershipPackageRequest;
import se.fishmarket_be.dto.response.MembershipPackageResponse;
import se.fishmarket_be.exception.ResourceNotFoundException;
import se.fishmarket_be.mapper.ModelMapper;
import se.fishmarket_be.pojo.MembershipPackage;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.repository.MembershipPackageRepository;
import se.fishmarket_be.repository.UserRepository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MembershipService Unit Tests")
class MembershipServiceTest {

    @Mock
    private MembershipPackageRepository membershipPackageRepository;

    @Mock
    private UserRepository userRepository;

    @Spy
    private ModelMapper modelMapper = new ModelMapper();

    @InjectMocks
    private MembershipService membershipService;

    private MembershipPackage basic;
    private User seller;

    @BeforeEach
    void setUp() {
        basic = MembershipPackage.builder()
                .packageId(1L)
                .name("Basic")
                .price(new BigDecimal("49000.00"))
                .durationDays(30)
                .maxAds(10)
                .boostCredits(2)
                .features(new ArrayList<>(List.of("10 active ads")))
                .isActive(true)
                .build();
        seller = User.builder().userId(7L).email("s@fish.vn").boostCredits(4).build();
    }

    @Test
    @DisplayName("createMembershipPackage - defaults credits to zero and normalises the price")
    void createPackage_Defaults() {
        // Given
        MembershipPackageRequest request = new MembershipPackageRequest();
        request.setName("Starter");
        request.setPrice(new BigDecimal("19000"));
        request.setDurationDays(7);
        request.setMaxAds(3);
        when(membershipPackageRepository.save(any(MembershipPackage.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // When
        MembershipPackageResponse result = membershipService.createMembershipPackage(request);

        // Then
        assertThat(result.getBoostCredits()).isZero();
        assertThat(result.getPrice()).isEqualTo(new BigDecimal("19000.00"));
        assertThat(result.getFeatures()).isEmpty();
        assertThat(result.getIsActive()).isTrue();
    }

    @Test
    @DisplayName("updateMembershipPackage - replaces features and keeps untouched fields")
    void updatePackage_Partial() {
        // Given
        MembershipPackageRequest request = new MembershipPackageRequest();
        request.setFeatures(List.of("Priority support", "20 active ads"));
        when(membershipPackageRepository.findById(1L)).thenReturn(Optional.of(basic));
        when(membershipPackageRepository.save(basic)).thenReturn(basic);

        // When
        MembershipPackageResponse result = membershipService.updateMembershipPackage(1L, request);

        // Then
        assertThat(result.getFeatures()).containsExactly("Priority support", "20 active ads");
        assertThat(result.getName()).isEqualTo("Basic");
        assertThat(result.getMaxAds()).isEqualTo(10);
    }

    @Test
    @DisplayName("deactivateMembershipPackage - soft delete, false when missing")
    void deactivatePackage() {
        // Given
        when(membershipPackageRepository.findById(1L)).thenReturn(Optional.of(basic));
        when(membershipPackageRepository.findById(2L)).thenReturn(Optional.empty());

        // When / Then
        assertThat(membershipService.deactivateMembershipPackage(1L)).isTrue();
        assertThat(basic.isActive()).isFalse();
        assertThat(membershipService.deactivateMembershipPackage(2L)).isFalse();
    }

    @Test
    @DisplayName("findActivePackage - inactive package is NotFoundOrInactive")
    void findActivePackage_Inactive() {
        when(membershipPackageRepository.findByPackageIdAndIsActiveTrue(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> membershipService.findActivePackage(1L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Membership package not found or inactive");
    }

    @Test
    @DisplayName("assignMembershipToUser - sets the membership without granting credits")
    void assign_NoCredits() {
        // Given
        when(membershipPackageRepository.findByPackageIdAndIsActiveTrue(1L)).thenReturn(Optional.of(basic));
        when(userRepository.findById(7L)).thenReturn(Optional.of(seller));

        // When
        boolean result = membershipService.assignMembershipToUser(7L, 1L);

        // Then
        assertThat(result).isTrue();
        assertThat(seller.getMembership()).isSameAs(basic);
        assertThat(seller.getBoostCredits()).isEqualTo(4);
        verify(userRepository).save(seller);
    }

    @Test
    @DisplayName("assignMembershipToUser - inactive package fails before the user is loaded")
    void assign_InactivePackage() {
        // Given
        when(membershipPackageRepository.findByPackageIdAndIsActiveTrue(1L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> membershipService.assignMembershipToUser(7L, 1L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Membership package not found or inactive");
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("assignMembershipToUser - unknown user is NotFound")
    void assign_UnknownUser() {
        // Given
        when(membershipPackageRepository.findByPackageIdAndIsActiveTrue(1L)).thenReturn(Optional.of(basic));
        when(userRepository.findById(7L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> membershipService.assignMembershipToUser(7L, 1L))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(userRepository, never()).save(any());
    }
}
