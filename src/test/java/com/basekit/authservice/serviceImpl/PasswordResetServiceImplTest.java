package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.exception.OtpExceptions;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.MailService;
import com.basekit.authservice.service.OtpService;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PasswordResetServiceImplTest {

    private static final String PHONE = "+2348012345678";
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private OtpService otpService;

    @Mock
    private PasswordService passwordService;

    @Mock
    private MailService mailService;

    private PasswordResetServiceImpl passwordResetService;

    @BeforeEach
    void setUp() {
        passwordResetService = new PasswordResetServiceImpl(userRepository, otpService, passwordService, mailService,
                new PhoneNumberNormalizer("234", 10), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private User user() {
        return User.builder()
                .id(UUID.randomUUID())
                .firstName("Ada")
                .email("ada@example.com")
                .phone(PHONE)
                .password("old-hash")
                .phoneVerified(true)
                .build();
    }

    // ========== OTP path ==========

    @Test
    void requestResetOtp_KnownPhone_IssuesResetCode() {
        User user = user();
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));

        passwordResetService.requestResetOtp("08012345678");

        verify(otpService).issue(user, OtpPurpose.PASSWORD_RESET);
    }

    @Test
    void requestResetOtp_UnknownPhone_UserNotFound() {
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> passwordResetService.requestResetOtp(PHONE))
                .isInstanceOf(RequestExceptions.BadRequest.class)
                .hasMessage("User not found");
        verifyNoInteractions(otpService);
    }

    @Test
    void resetWithOtp_ValidCode_ConsumesThenChangesPasswordInOneSave() {
        // Given
        User user = user();
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));

        // When
        passwordResetService.resetWithOtp(PHONE, "123456", "NewSecret#1");

        // Then
        InOrder order = inOrder(otpService, passwordService, userRepository);
        order.verify(otpService).consume(user, OtpPurpose.PASSWORD_RESET, "123456");
        order.verify(passwordService).applyNewPassword(user, "NewSecret#1");
        order.verify(userRepository).save(user);
    }

    @Test
    void resetWithOtp_ExpiredCode_PasswordUntouched() {
        User user = user();
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        doThrow(new OtpExceptions.OtpExpired()).when(otpService).consume(user, OtpPurpose.PASSWORD_RESET, "123456");

        assertThatThrownBy(() -> passwordResetService.resetWithOtp(PHONE, "123456", "NewSecret#1"))
                .isInstanceOf(OtpExceptions.OtpExpired.class);
        verifyNoInteractions(passwordService);
        verify(userRepository, never()).save(any());
    }

    // ========== link path ==========

    @Test
    void requestResetToken_UnknownEmail_SilentlyDoesNothing() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        passwordResetService.requestResetToken("ghost@example.com");

        verify(userRepository, never()).save(any());
        verifyNoInteractions(mailService);
    }

    @Test
    void requestResetToken_KnownEmail_StoresHexTokenWithOneHourExpiryAndMailsIt() {
        // Given
        User user = user();
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        passwordResetService.requestResetToken(" Ada@Example.com");

        // Then
        assertThat(user.getResetPasswordToken()).matches("[0-9a-f]{64}");
        assertThat(user.getResetPasswordExpires()).isEqualTo(NOW.plus(Duration.ofMinutes(60)));
        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        verify(mailService).sendResetToken(eq("ada@example.com"), token.capture(), eq("Ada"));
        assertThat(token.getValue()).isEqualTo(user.getResetPasswordToken());
    }

    @Test
    void requestResetToken_Twice_SecondTokenReplacesFirst() {
        User user = user();
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        passwordResetService.requestResetToken("ada@example.com");
        String first = user.getResetPasswordToken();
        passwordResetService.requestResetToken("ada@example.com");

        assertThat(user.getResetPasswordToken()).isNotEqualTo(first);
        verify(mailService, times(2)).sendResetToken(anyString(), anyString(), anyString());
    }

    @Test
    void resetWithToken_ValidToken_AppliesPassword() {
        User user = user();
        when(userRepository.findFirstByResetPasswordTokenAndResetPasswordExpiresAfter("tok", NOW))
                .thenReturn(Optional.of(user));

        passwordResetService.resetWithToken("tok", "NewSecret#1");

        verify(passwordService).applyNewPassword(user, "NewSecret#1");
        verify(userRepository).save(user);
    }

    @Test
    void resetWithToken_UnknownOrExpiredToken_SameMessage() {
        // the query filters on the deadline, so both cases come back empty
        when(userRepository.findFirstByResetPasswordTokenAndResetPasswordExpiresAfter("tok", NOW))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> passwordResetService.resetWithToken("tok", "NewSecret#1"))
                .isInstanceOf(RequestExceptions.BadRequest.class)
                .hasMessage(PasswordResetServiceImpl.INVALID_TOKEN);
        verifyNoInteractions(passwordService);
    }

    @Test
    void resetWithToken_BlankToken_Rejected() {
        assertThatThrownBy(() -> passwordResetService.resetWithToken(" ", "NewSecret#1"))
                .isInstanceOf(RequestExceptions.BadRequest.class)
                .hasMessage(PasswordResetServiceImpl.INVALID_TOKEN);
        verifyNoInteractions(userRepository);
    }
}
