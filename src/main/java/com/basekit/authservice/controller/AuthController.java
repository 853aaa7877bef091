package com.basekit.authservice.controller;

import com.basekit.authservice.dto.*;
import com.basekit.authservice.service.AuthService;
import com.basekit.authservice.service.PasswordResetService;
import com.basekit.authservice.service.RegistrationService;
import com.basekit.authservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final RegistrationService registrationService;
    private final PasswordResetService passwordResetService;

    @GetMapping("/ping")
    public String ping() {
        return "pong";
    }

    /** Envelope message says whether the verification code went out. */
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        SignupResponse body = registrationService.signup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    @ResponseMessage("Login successful")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/verify-phone")
    public ResponseEntity<MessageResponse> verifyPhone(@Valid @RequestBody VerifyPhoneRequest request) {
        registrationService.verifyPhone(request.phone(), request.otp());
        return ResponseEntity.ok(new MessageResponse("Phone number verified successfully"));
    }

    @PostMapping("/resend-verification")
    @ResponseMessage("Verification OTP sent")
    public ResponseEntity<OtpStatus> resendVerification(@Valid @RequestBody PhoneRequest request) {
        return ResponseEntity.ok(registrationService.resendVerificationOtp(request.phone()));
    }

    @PostMapping("/forgot-password-otp")
    @ResponseMessage("Password reset OTP sent")
    public ResponseEntity<OtpStatus> forgotPasswordOtp(@Valid @RequestBody PhoneRequest request) {
        return ResponseEntity.ok(passwordResetService.requestResetOtp(request.phone()));
    }

    @PostMapping("/reset-password-otp")
    public ResponseEntity<MessageResponse> resetPasswordOtp(@Valid @RequestBody ResetPasswordOtpRequest request) {
        passwordResetService.resetWithOtp(request.phone(), request.otp(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse("Password reset successfully"));
    }

    /** Same answer whether or not the email is registered. */
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        passwordResetService.requestResetToken(request.email());
        return ResponseEntity.ok(new MessageResponse("If that email is registered, a reset link has been sent"));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetWithToken(request.token(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse("Password reset successfully"));
    }

    @PostMapping("/request-email-verification")
    @ResponseMessage("Email verification OTP sent")
    public ResponseEntity<OtpStatus> requestEmailVerification(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(registrationService.requestEmailVerificationOtp(request.email()));
    }

    @PostMapping("/verify-email")
    public ResponseEntity<MessageResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        registrationService.verifyEmail(request.email(), request.otp());
        return ResponseEntity.ok(new MessageResponse("Email verified successfully"));
    }
}
