package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.SecurityConfig.JwtTokenProviderConfig;
import com.basekit.authservice.dto.LoginRequest;
import com.basekit.authservice.dto.LoginResponse;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.AuthExceptions;
import com.basekit.authservice.exception.UserExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceImplTest {

    private static final String PHONE = "+2348012345678";
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordService passwordService;

    @Mock
    private JwtTokenProviderConfig jwtTokenProvider;

    private AuthServiceImpl authService;

    @BeforeEach
    void setUp() {
        authService = new AuthServiceImpl(userRepository, passwordService, jwtTokenProvider,
                new PhoneNumberNormalizer("234", 10), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private User user(boolean active, boolean phoneVerified) {
        return User.builder()
                .id(UUID.randomUUID())
                .firstName("Ada")
                .lastName("Obi")
                .email("ada@example.com")
                .phone(PHONE)
                .password("hash")
                .active(active)
                .phoneVerified(phoneVerified)
                .build();
    }

    @Test
    void login_VerifiedActiveUser_ReturnsBearerToken() {
        // Given
        User user = user(true, true);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        when(passwordService.matches("Secret#123", "hash")).thenReturn(true);
        when(jwtTokenProvider.generateToken(user)).thenReturn("jwt");
        when(jwtTokenProvider.getTokenValiditySeconds()).thenReturn(1800L);

        // When
        LoginResponse response = authService.login(new LoginRequest("08012345678", "Secret#123"));

        // Then
        assertThat(response.getAccessToken()).isEqualTo("jwt");
        assertThat(response.getTokenType()).isEqualTo("Bearer");
        assertThat(response.getExpiresIn()).isEqualTo(1800L);
        assertThat(response.getIssuedAt()).isEqualTo(NOW);
        assertThat(response.getUser().getPhone()).isEqualTo(PHONE);
    }

    @Test
    void login_UnknownPhone_Unauthorized() {
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest(PHONE, "Secret#123")))
                .isInstanceOf(AuthExceptions.Unauthorized.class)
                .hasMessage(AuthServiceImpl.INVALID_CREDENTIALS);
    }

    @Test
    void login_UnparseablePhone_SameAnswerAsUnknown() {
        assertThatThrownBy(() -> authService.login(new LoginRequest("not-a-phone", "Secret#123")))
                .isInstanceOf(AuthExceptions.Unauthorized.class)
                .hasMessage(AuthServiceImpl.INVALID_CREDENTIALS);
        verifyNoInteractions(userRepository);
    }

    @Test
    void login_WrongPasswordOnInactiveUnverifiedAccount_UnauthorizedFirst() {
        User user = user(false, false);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        when(passwordService.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login(new LoginRequest(PHONE, "wrong")))
                .isInstanceOf(AuthExceptions.Unauthorized.class);
        verify(jwtTokenProvider, never()).generateToken(any());
    }

    @Test
    void login_DeactivatedAndUnverified_DeactivationReportedFirst() {
        User user = user(false, false);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        when(passwordService.matches("Secret#123", "hash")).thenReturn(true);

        assertThatThrownBy(() -> authService.login(new LoginRequest(PHONE, "Secret#123")))
                .isInstanceOf(AuthExceptions.Forbidden.class)
                .hasMessage("Your account has been deactivated");
    }

    @Test
    void login_PhoneNotVerified_Forbidden() {
        User user = user(true, false);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        when(passwordService.matches("Secret#123", "hash")).thenReturn(true);

        assertThatThrownBy(() -> authService.login(new LoginRequest(PHONE, "Secret#123")))
                .isInstanceOf(AuthExceptions.Forbidden.class)
                .hasMessage("Please verify your phone number before logging in");
        verify(jwtTokenProvider, never()).generateToken(any());
    }

    @Test
    void currentUser_Missing_UserNotFound() {
        UUID id = UUID.randomUUID();
        when(userRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.currentUser(id))
                .isInstanceOf(UserExceptions.UserNotFound.class);
    }
}
