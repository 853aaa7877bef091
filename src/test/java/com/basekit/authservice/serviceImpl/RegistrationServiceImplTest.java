package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.dto.OtpStatus;
import com.basekit.authservice.dto.PhoneValidationResult;
import com.basekit.authservice.dto.SignupRequest;
import com.basekit.authservice.dto.SignupResponse;
import com.basekit.authservice.entity.OtpPurpose;
import com.basekit.authservice.entity.User;
import com.basekit.authservice.entity.UserRole;
import com.basekit.authservice.exception.ExternalExceptions;
import com.basekit.authservice.exception.OtpExceptions;
import com.basekit.authservice.exception.RequestExceptions;
import com.basekit.authservice.exception.UserExceptions;
import com.basekit.authservice.repository.UserRepository;
import com.basekit.authservice.service.OtpService;
import com.basekit.authservice.service.PasswordService;
import com.basekit.authservice.service.SmsService;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceImplTest {

    private static final String PHONE = "+2348012345678";

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordService passwordService;

    @Mock
    private OtpService otpService;

    @Mock
    private SmsService smsService;

    private RegistrationServiceImpl registrationService;

    @BeforeEach
    void setUp() {
        registrationService = new RegistrationServiceImpl(userRepository, passwordService, otpService, smsService,
                new PhoneNumberNormalizer("234", 10));
    }

    private SignupRequest request() {
        return SignupRequest.builder()
                .firstName(" Ada ")
                .lastName("Obi")
                .email("Ada@Example.com")
                .phone("08012345678")
                .password("Secret#123")
                .build();
    }

    private User existing() {
        return User.builder()
                .id(UUID.randomUUID())
                .firstName("Ada")
                .email("ada@example.com")
                .phone(PHONE)
                .password("hash")
                .build();
    }

    // ========== signup() ==========

    @Test
    void signup_ValidRequest_StoresNormalizedUserAndSendsOtp() {
        // Given
        when(smsService.validatePhoneNumber("08012345678")).thenReturn(PhoneValidationResult.valid(PHONE));
        when(passwordService.hash("Secret#123")).thenReturn("bcrypt-hash");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(UUID.randomUUID());
            return u;
        });
        OtpStatus status = new OtpStatus(1, 3, Instant.parse("2026-03-10T12:05:00Z"), 10);
        when(otpService.status(any(User.class))).thenReturn(status);

        // When
        SignupResponse response = registrationService.signup(request());

        // Then
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        User saved = captor.getValue();
        assertThat(saved.getPhone()).isEqualTo(PHONE);
        assertThat(saved.getEmail()).isEqualTo("ada@example.com");
        assertThat(saved.getFirstName()).isEqualTo("Ada");
        assertThat(saved.getPassword()).isEqualTo("bcrypt-hash");
        assertThat(saved.getRole()).isEqualTo(UserRole.USER);
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.isPhoneVerified()).isFalse();
        assertThat(saved.isEmailVerified()).isTrue();

        verify(otpService).issue(saved, OtpPurpose.PHONE_VERIFICATION);
        assertThat(response.isOtpSent()).isTrue();
        assertThat(response.getMessage()).isEqualTo(RegistrationServiceImpl.SIGNUP_OK);
        assertThat(response.getOtp()).isEqualTo(status);
        assertThat(response.getUser().getId()).isEqualTo(saved.getId().toString());
    }

    @Test
    void signup_OtpDeliveryFails_UserKeptAndOtpSentFalse() {
        // Given
        when(smsService.validatePhoneNumber(anyString())).thenReturn(PhoneValidationResult.valid(PHONE));
        when(passwordService.hash(anyString())).thenReturn("bcrypt-hash");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        when(otpService.issue(any(User.class), eq(OtpPurpose.PHONE_VERIFICATION)))
                .thenThrow(new ExternalExceptions.DeliveryFailed("gateway down"));

        // When
        SignupResponse response = registrationService.signup(request());

        // Then
        assertThat(response.isOtpSent()).isFalse();
        assertThat(response.getMessage()).isEqualTo(RegistrationServiceImpl.SIGNUP_OTP_FAILED);
        assertThat(response.getUser().getPhone()).isEqualTo(PHONE);
        assertThat(response.getOtp()).isNull();
        verify(userRepository).save(any(User.class));
    }

    @Test
    void signup_InvalidPhone_RejectedWithNormalizerReason() {
        when(smsService.validatePhoneNumber("123")).thenReturn(PhoneValidationResult.invalid("Invalid phone number format"));
        SignupRequest request = request();
        request.setPhone("123");

        assertThatThrownBy(() -> registrationService.signup(request))
                .isInstanceOf(RequestExceptions.InvalidParameter.class)
                .hasMessage("Invalid phone number format");
        verifyNoInteractions(userRepository, otpService);
    }

    @Test
    void signup_PhoneAndEmailTaken_PhoneReportedFirst() {
        when(smsService.validatePhoneNumber(anyString())).thenReturn(PhoneValidationResult.valid(PHONE));
        when(userRepository.existsByPhone(PHONE)).thenReturn(true);

        assertThatThrownBy(() -> registrationService.signup(request()))
                .isInstanceOf(UserExceptions.UserAlreadyExists.class)
                .hasMessage("User with this phone number already exists");
        verify(userRepository, never()).save(any());
    }

    @Test
    void signup_EmailTaken_Rejected() {
        when(smsService.validatePhoneNumber(anyString())).thenReturn(PhoneValidationResult.valid(PHONE));
        when(userRepository.existsByPhone(PHONE)).thenReturn(false);
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(true);

        assertThatThrownBy(() -> registrationService.signup(request()))
                .isInstanceOf(UserExceptions.UserAlreadyExists.class)
                .hasMessage("User with this email already exists");
    }

    // ========== verifyPhone() ==========

    @Test
    void verifyPhone_NationalFormat_LooksUpE164AndSaves() {
        User user = existing();
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));

        registrationService.verifyPhone("0801 234 5678", "123456");

        verify(otpService).consume(user, OtpPurpose.PHONE_VERIFICATION, "123456");
        verify(userRepository).save(user);
    }

    @Test
    void verifyPhone_AlreadyVerified_Rejected() {
        User user = existing();
        user.setPhoneVerified(true);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> registrationService.verifyPhone(PHONE, "123456"))
                .isInstanceOf(OtpExceptions.AlreadyVerified.class)
                .hasMessage("Phone number is already verified");
        verifyNoInteractions(otpService);
    }

    @Test
    void verifyPhone_WrongCode_NothingSaved() {
        User user = existing();
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        doThrow(new OtpExceptions.OtpMismatch()).when(otpService).consume(user, OtpPurpose.PHONE_VERIFICATION, "000000");

        assertThatThrownBy(() -> registrationService.verifyPhone(PHONE, "000000"))
                .isInstanceOf(OtpExceptions.OtpMismatch.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    void verifyPhone_UnparseablePhone_UserNotFound() {
        assertThatThrownBy(() -> registrationService.verifyPhone("abc", "123456"))
                .isInstanceOf(RequestExceptions.BadRequest.class)
                .hasMessage("User not found");
        verifyNoInteractions(userRepository);
    }

    // ========== resend / email ==========

    @Test
    void resendVerificationOtp_IssuesPhoneCodeAndReturnsStatus() {
        User user = existing();
        OtpStatus status = new OtpStatus(2, 3, null, 10);
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.of(user));
        when(otpService.status(user)).thenReturn(status);

        assertThat(registrationService.resendVerificationOtp("+234 801 234 5678")).isEqualTo(status);
        verify(otpService).issue(user, OtpPurpose.PHONE_VERIFICATION);
    }

    @Test
    void resendVerificationOtp_UnknownPhone_UserNotFound() {
        when(userRepository.findByPhone(PHONE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> registrationService.resendVerificationOtp(PHONE))
                .isInstanceOf(RequestExceptions.BadRequest.class)
                .hasMessage("User not found");
    }

    @Test
    void verifyEmail_CorrectCode_Saves() {
        User user = existing();
        user.setEmailVerified(false);
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

        registrationService.verifyEmail("ADA@example.com ", "123456");

        verify(otpService).consume(user, OtpPurpose.EMAIL_VERIFICATION, "123456");
        verify(userRepository).save(user);
    }

    @Test
    void requestEmailVerificationOtp_IssuesEmailCode() {
        User user = existing();
        user.setEmailVerified(false);
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));
        when(otpService.status(user)).thenReturn(new OtpStatus(1, 3, null, 10));

        registrationService.requestEmailVerificationOtp("ada@example.com");

        verify(otpService).issue(user, OtpPurpose.EMAIL_VERIFICATION);
    }
}
