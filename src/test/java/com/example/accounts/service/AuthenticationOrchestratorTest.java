package com.example.accounts.service;

import com.example.accounts.TestBotConfigs;
import com.example.accounts.config.BotConfig;
import com.example.accounts.controllers.AccountClient;
import com.example.accounts.controllers.AccountClientFactory;
import com.example.accounts.dto.AccountIdentity;
import com.example.accounts.model.ConversationState;
import com.example.accounts.model.PhoneNumberStatus;
import com.example.accounts.service.exception.AccountClientException;
import com.example.accounts.service.exception.FloodWaitException;
import com.example.accounts.service.exception.PasswordInvalidException;
import com.example.accounts.service.exception.PhoneCodeInvalidException;
import com.example.accounts.service.exception.SessionPasswordNeededException;
import com.example.accounts.service.util.Msg;
import com.example.accounts.service.util.SessionNames;
import com.example.accounts.service.util.UserLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mockito;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthenticationOrchestratorTest {

    private static final Long USER = 100L;
    private static final String PHONE = "+15551234567";
    private static final Long RECORD = 5L;
    private static final Locale EN = Locale.ENGLISH;

    private AccountClientFactory clientFactory;
    private AccountClient client;
    private SessionStore sessionStore;
    private ConversationStateMachine stateMachine;
    private PendingAuthenticationRegistry registry;
    private AuthenticationOrchestrator orchestrator;
    private List<String> notices;

    @BeforeEach
    void setUp() {
        BotConfig config = TestBotConfigs.defaults();
        clientFactory = Mockito.mock(AccountClientFactory.class);
        client = Mockito.mock(AccountClient.class);
        sessionStore = Mockito.mock(SessionStore.class);

        ResourceBundleMessageSource messages = new ResourceBundleMessageSource();
        messages.setBasename("messages");
        messages.setDefaultEncoding("UTF-8");
        messages.setFallbackToSystemLocale(false);

        stateMachine = Mockito.spy(new ConversationStateMachine(config));
        registry = new PendingAuthenticationRegistry(clientFactory, sessionStore, new SessionNames(config), config);
        orchestrator = new AuthenticationOrchestrator(stateMachine, registry, sessionStore, new UserLocks(),
                new Msg(messages));
        notices = new ArrayList<>();

        when(clientFactory.connect(anyString())).thenReturn(client);
        when(client.requestCode(PHONE)).thenReturn("code-hash");
        when(sessionStore.insertPhoneNumber(USER, PHONE)).thenReturn(RECORD);
    }

    @Test
    void shouldIgnoreFreeTextWhenIdle() {
        assertThat(input("hello")).isEmpty();
        Mockito.verifyNoInteractions(sessionStore, clientFactory);
    }

    @Test
    void shouldAskForPhoneNumberFromMenu() {
        BotReply reply = orchestrator.startPhoneEntry(USER, EN);

        assertThat(reply.text()).contains("international format");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_PHONE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"15551234567", "+1555", "hello"})
    void shouldStayAwaitingPhoneOnMalformedNumber(String input) {
        orchestrator.startPhoneEntry(USER, EN);

        BotReply reply = input(input).orElseThrow();

        assertThat(reply.text()).contains("Invalid phone number format");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_PHONE);
        verify(sessionStore, never()).insertPhoneNumber(any(), any());
        verify(stateMachine, times(2)).moveTo(USER, ConversationState.AWAITING_PHONE);
    }

    @Test
    void shouldReportSecretStepsOnly() {
        assertThat(orchestrator.expectsSecret(USER)).isFalse();

        orchestrator.startPhoneEntry(USER, EN);
        assertThat(orchestrator.expectsSecret(USER)).isFalse();

        input(PHONE);
        assertThat(orchestrator.expectsSecret(USER)).isTrue();

        when(client.signInWithCode(PHONE, "12345", "code-hash"))
                .thenThrow(new SessionPasswordNeededException("SESSION_PASSWORD_NEEDED"));
        input("12345");
        assertThat(orchestrator.expectsSecret(USER)).isTrue();
    }

    @Test
    void shouldRequestCodeForValidPhoneNumber() {
        orchestrator.startPhoneEntry(USER, EN);

        BotReply reply = input(PHONE).orElseThrow();

        assertThat(reply.text()).contains("verification code");
        assertThat(reply.deleteInput()).isFalse();
        assertThat(notices).hasSize(1);
        assertThat(notices.get(0)).contains("Sending verification code");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_CODE);
        assertThat(registry.find(USER)).isPresent();
        verify(sessionStore).insertPhoneNumber(USER, PHONE);
    }

    @Test
    void shouldReturnToIdleWhenAlreadyAuthenticated() {
        when(client.isAuthorized()).thenReturn(true);
        orchestrator.startPhoneEntry(USER, EN);

        BotReply reply = input(PHONE).orElseThrow();

        assertThat(reply.text()).contains("already authenticated");
        assertThat(reply.showMainMenu()).isTrue();
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
    }

    @Test
    void shouldShowWaitDurationWhenRateLimited() {
        when(client.requestCode(PHONE)).thenThrow(new FloodWaitException(1200));
        orchestrator.startPhoneEntry(USER, EN);

        BotReply reply = input(PHONE).orElseThrow();

        assertThat(reply.text()).contains("1200 seconds");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
    }

    @Test
    void shouldSignInWithCorrectCode() {
        startCodeStep();
        when(client.signInWithCode(PHONE, "12345", "code-hash")).thenReturn(new AccountIdentity(1L, "a", "A"));

        BotReply reply = input("12345").orElseThrow();

        assertThat(reply.text()).contains("Authentication successful");
        assertThat(reply.showMainMenu()).isTrue();
        assertThat(reply.deleteInput()).isTrue();
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
        verify(sessionStore).updatePhoneStatus(RECORD, PhoneNumberStatus.AUTHENTICATED, true);
    }

    @Test
    void shouldAskForPasswordWhenSecondFactorIsEnabled() {
        startCodeStep();
        when(client.signInWithCode(eq(PHONE), eq("12345"), anyString()))
                .thenThrow(new SessionPasswordNeededException("SESSION_PASSWORD_NEEDED"));

        BotReply reply = input("12345").orElseThrow();

        assertThat(reply.text()).contains("2FA password");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_TWO_FACTOR);
        assertThat(registry.find(USER)).isPresent();
    }

    @Test
    void shouldLetUserRetryInvalidCode() {
        startCodeStep();
        when(client.signInWithCode(eq(PHONE), eq("00000"), anyString()))
                .thenThrow(new PhoneCodeInvalidException("PHONE_CODE_INVALID"));

        BotReply reply = input("00000").orElseThrow();

        assertThat(reply.text()).contains("Invalid verification code");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_CODE);
        assertThat(registry.find(USER)).isPresent();
    }

    @Test
    void shouldEndFlowOnWrongPassword() {
        startCodeStep();
        when(client.signInWithCode(eq(PHONE), anyString(), anyString()))
                .thenThrow(new SessionPasswordNeededException("SESSION_PASSWORD_NEEDED"));
        input("12345");
        when(client.signInWithPassword("wrong")).thenThrow(new PasswordInvalidException("PASSWORD_HASH_INVALID"));

        BotReply reply = input("wrong").orElseThrow();

        assertThat(reply.text()).contains("Invalid 2FA password");
        assertThat(reply.deleteInput()).isTrue();
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
        assertThat(registry.find(USER)).isEmpty();
        verify(sessionStore, never()).updatePhoneStatus(RECORD, PhoneNumberStatus.AUTHENTICATED, true);
        verify(sessionStore, never()).upsertSession(any(), any(), any());
    }

    @Test
    void shouldCompleteLoginWithPassword() {
        startCodeStep();
        when(client.signInWithCode(eq(PHONE), anyString(), anyString()))
                .thenThrow(new SessionPasswordNeededException("SESSION_PASSWORD_NEEDED"));
        input("12345");
        when(client.signInWithPassword(" pass phrase ")).thenReturn(new AccountIdentity(1L, "a", "A"));

        BotReply reply = input(" pass phrase ").orElseThrow();

        assertThat(reply.text()).contains("2FA authentication successful");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
        verify(sessionStore).updatePhoneStatus(RECORD, PhoneNumberStatus.AUTHENTICATED, true);
    }

    @Test
    void shouldAskToStartOverWhenNoLoginIsPending() {
        stateMachine.moveTo(USER, ConversationState.AWAITING_CODE);

        BotReply reply = input("12345").orElseThrow();

        assertThat(reply.text()).contains("No login in progress");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
        Mockito.verifyNoInteractions(sessionStore);
    }

    @Test
    void shouldHideProviderDetailFromUser() {
        startCodeStep();
        when(client.signInWithCode(eq(PHONE), anyString(), anyString()))
                .thenThrow(new AccountClientException("phone_code_hash=code-hash AUTH_KEY_UNREGISTERED"));

        BotReply reply = input("12345").orElseThrow();

        assertThat(reply.text()).doesNotContain("code-hash").doesNotContain("AUTH_KEY");
        assertThat(reply.text()).contains("could not be completed");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
        assertThat(registry.find(USER)).isEmpty();
    }

    @Test
    void shouldAbortFlowOnUnexpectedFailure() {
        when(sessionStore.insertPhoneNumber(USER, PHONE)).thenThrow(new IllegalStateException("database is down"));
        orchestrator.startPhoneEntry(USER, EN);

        BotReply reply = input(PHONE).orElseThrow();

        assertThat(reply.text()).contains("Something went wrong").doesNotContain("database");
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.IDLE);
    }

    @Test
    void shouldExpireAbandonedFlows() {
        startCodeStep();
        stateMachine.moveTo(200L, ConversationState.AWAITING_PHONE);

        assertThat(orchestrator.expireStaleFlows(LocalDateTime.now())).isZero();
        assertThat(orchestrator.expireStaleFlows(LocalDateTime.now().plusMinutes(11))).isEqualTo(2);

        assertThat(registry.pendingUserIds()).isEmpty();
        assertThat(stateMachine.trackedUserIds()).isEmpty();
        verify(client).disconnect();
    }

    private void startCodeStep() {
        orchestrator.startPhoneEntry(USER, EN);
        input(PHONE);
        assertThat(stateMachine.current(USER)).isEqualTo(ConversationState.AWAITING_CODE);
    }

    private Optional<BotReply> input(String text) {
        return orchestrator.handleInput(USER, text, EN, notices::add);
    }
}
