package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.config.OtpProperties;
import com.basekit.authservice.exception.ExternalExceptions;
import com.basekit.authservice.utils.PhoneNumberNormalizer;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.rest.api.v2010.account.MessageCreator;
import com.twilio.type.PhoneNumber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedStatic;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class TwilioSmsServiceImplTest {

    private static final String QA_PHONE = "+2348011110000";
    private static final String CUSTOMER_PHONE = "+2348012345678";

    private MockedStatic<Message> messageApi;
    private TwilioSmsServiceImpl smsService;

    @BeforeEach
    void setUp() {
        messageApi = mockStatic(Message.class);
        smsService = new TwilioSmsServiceImpl(
                new PhoneNumberNormalizer("234", 10),
                new OtpProperties(10, 3, 5),
                "AC00000000000000000000000000000000",
                "test-token",
                "+15005550006",
                Set.of(QA_PHONE));
    }

    @AfterEach
    void tearDown() {
        messageApi.close();
    }

    private void creatorAnswers(MessageCreator creator) {
        messageApi.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                .thenReturn(creator);
    }

    @Test
    void allowlistedNumber_SkipsApiAndKeepsCodeOutOfLogs(CapturedOutput output) {
        smsService.sendPhoneVerificationOtp(QA_PHONE, "482913", "Ada");
        smsService.sendPasswordResetOtp(QA_PHONE, "771204", "Ada");

        messageApi.verify(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()), never());
        assertThat(output.getOut())
                .contains("to=" + QA_PHONE + " purpose=phone-verification")
                .contains("to=" + QA_PHONE + " purpose=password-reset")
                .doesNotContain("482913")
                .doesNotContain("771204");
    }

    @Test
    void regularNumber_SentThroughTwilio(CapturedOutput output) {
        MessageCreator creator = mock(MessageCreator.class);
        Message sent = mock(Message.class);
        when(sent.getSid()).thenReturn("SM123");
        when(creator.create()).thenReturn(sent);
        creatorAnswers(creator);

        smsService.sendPhoneVerificationOtp(CUSTOMER_PHONE, "482913", "Ada");

        ArgumentCaptor<PhoneNumber> to = ArgumentCaptor.forClass(PhoneNumber.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        messageApi.verify(() -> Message.creator(to.capture(), any(PhoneNumber.class), body.capture()));
        assertThat(to.getValue().getEndpoint()).isEqualTo(CUSTOMER_PHONE);
        assertThat(body.getValue()).isEqualTo("Hi Ada, your verification code is 482913. It expires in 10 minutes.");
        assertThat(output.getOut()).contains("sid=SM123").doesNotContain("482913");
    }

    @Test
    void twilioRejection_DeliveryFailed() {
        MessageCreator creator = mock(MessageCreator.class);
        when(creator.create()).thenThrow(new com.twilio.exception.ApiException("Authenticate"));
        creatorAnswers(creator);

        assertThatThrownBy(() -> smsService.sendPasswordResetOtp(CUSTOMER_PHONE, "771204", "Ada"))
                .isInstanceOf(ExternalExceptions.DeliveryFailed.class)
                .hasMessage("Failed to send SMS. Please try again later.")
                .hasCauseInstanceOf(com.twilio.exception.ApiException.class);
    }
}
