/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.dispatch;

import org.elasticsoftware.behaviors.account.*;
import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.behaviors.dsl.BehaviorDsl;
import org.elasticsoftware.behaviors.events.EventOutcome;
import org.elasticsoftware.behaviors.log.EventLog;
import org.elasticsoftware.behaviors.log.EventRecord;
import org.elasticsoftware.behaviors.log.InMemoryEventLog;
import org.elasticsoftware.behaviors.log.SequenceMismatchException;
import org.elasticsoftware.behaviors.state.InMemoryAggregateStateRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class AggregateDispatcherTests {
    private final List<CompletableFuture<List<AccountEvent>>> pendingDeposits = new CopyOnWriteArrayList<>();
    private final List<Long> balancesSeen = new CopyOnWriteArrayList<>();
    private AggregateDispatcher<AccountCommand, AccountEvent, AccountState> dispatcher;

    @AfterEach
    public void closeDispatcher() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    public void testAcceptedCommandsAreAppendedAndFolded() throws Exception {
        InMemoryEventLog<AccountEvent> eventLog = new InMemoryEventLog<>(Accounts.NAME);
        dispatcher = dispatcher(Accounts.behavior(), eventLog, 4, Duration.ofSeconds(5));

        ProcessedCommand<AccountEvent, AccountState> opened = accepted(dispatcher.submit(new OpenAccountCommand("account-1", 100)));
        ProcessedCommand<AccountEvent, AccountState> deposited = accepted(dispatcher.submit(new DepositCommand("account-1", 25)));
        ProcessedCommand<AccountEvent, AccountState> withdrawn = accepted(dispatcher.submit(new WithdrawCommand("account-1", 50)));

        assertEquals(new AccountState("account-1", 100), opened.state());
        assertEquals(new AccountState("account-1", 125), deposited.state());
        assertEquals(new AccountState("account-1", 75), withdrawn.state());
        assertEquals(1, opened.events().get(0).sequenceNumber());
        assertEquals(2, deposited.events().get(0).sequenceNumber());
        assertEquals(3, withdrawn.events().get(0).sequenceNumber());
        assertEquals(List.of(
                        new EventRecord<AccountEvent>("account-1", 1, new AccountOpenedEvent("account-1", 100)),
                        new EventRecord<AccountEvent>("account-1", 2, new DepositedEvent("account-1", 25)),
                        new EventRecord<AccountEvent>("account-1", 3, new WithdrawalApprovedEvent("account-1", 50))),
                eventLog.read("account-1"));
        assertEquals(Optional.of(new AccountState("account-1", 75)), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testRejectedCommandIsNotAppended() throws Exception {
        InMemoryEventLog<AccountEvent> eventLog = new InMemoryEventLog<>(Accounts.NAME);
        dispatcher = dispatcher(Accounts.behavior(), eventLog, 4, Duration.ofSeconds(5));

        CommandResult<ProcessedCommand<AccountEvent, AccountState>> result =
                dispatcher.submit(new DepositCommand("account-1", 25)).get(5, TimeUnit.SECONDS);

        Rejection rejection = assertInstanceOf(CommandResult.Rejected.class, result).rejection();
        assertEquals(Rejection.Kind.INVALID_COMMAND_FOR_CREATION, rejection.kind());
        assertEquals(0, eventLog.lastSequenceNumber("account-1"));
        assertEquals(Optional.empty(), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testCommandsForSameAggregateAreProcessedOneAfterTheOther() throws Exception {
        dispatcher = dispatcher(deferredDeposits(), new InMemoryEventLog<>(Accounts.NAME), 2, Duration.ofSeconds(5));
        accepted(dispatcher.submit(new OpenAccountCommand("account-1", 100)));

        CompletableFuture<CommandResult<ProcessedCommand<AccountEvent, AccountState>>> first = dispatcher.submit(new DepositCommand("account-1", 10));
        CompletableFuture<CommandResult<ProcessedCommand<AccountEvent, AccountState>>> second = dispatcher.submit(new DepositCommand("account-1", 20));

        waitUntil(() -> pendingDeposits.size() == 1);
        Thread.sleep(100);
        assertEquals(1, pendingDeposits.size());
        assertFalse(second.isDone());

        pendingDeposits.get(0).complete(List.of(new DepositedEvent("account-1", 10)));
        assertEquals(new AccountState("account-1", 110), accepted(first).state());

        waitUntil(() -> pendingDeposits.size() == 2);
        pendingDeposits.get(1).complete(List.of(new DepositedEvent("account-1", 20)));
        assertEquals(new AccountState("account-1", 130), accepted(second).state());
        assertEquals(List.of(100L, 110L), balancesSeen);
    }

    @Test
    public void testWaitingAggregateDoesNotBlockOthers() throws Exception {
        dispatcher = dispatcher(deferredDeposits(), new InMemoryEventLog<>(Accounts.NAME), 1, Duration.ofSeconds(5));
        accepted(dispatcher.submit(new OpenAccountCommand("account-1", 100)));
        accepted(dispatcher.submit(new OpenAccountCommand("account-2", 5)));

        CompletableFuture<CommandResult<ProcessedCommand<AccountEvent, AccountState>>> blocked = dispatcher.submit(new DepositCommand("account-1", 10));
        waitUntil(() -> pendingDeposits.size() == 1);

        assertEquals(new AccountState("account-2", 0), accepted(dispatcher.submit(new WithdrawCommand("account-2", 5))).state());
        assertFalse(blocked.isDone());

        pendingDeposits.get(0).complete(List.of(new DepositedEvent("account-1", 10)));
        assertEquals(new AccountState("account-1", 110), accepted(blocked).state());
    }

    @Test
    public void testSlowValidationTimesOutAndLateResultIsDiscarded() throws Exception {
        InMemoryEventLog<AccountEvent> eventLog = new InMemoryEventLog<>(Accounts.NAME);
        dispatcher = dispatcher(deferredDeposits(), eventLog, 2, Duration.ofMillis(100));
        accepted(dispatcher.submit(new OpenAccountCommand("account-1", 100)));

        CommandResult<ProcessedCommand<AccountEvent, AccountState>> result =
                dispatcher.submit(new DepositCommand("account-1", 10)).get(5, TimeUnit.SECONDS);

        Rejection rejection = assertInstanceOf(CommandResult.Rejected.class, result).rejection();
        assertEquals(Rejection.Kind.TIMED_OUT, rejection.kind());
        assertEquals("account-1", rejection.aggregateId());

        pendingDeposits.get(0).complete(List.of(new DepositedEvent("account-1", 10)));
        Thread.sleep(100);

        assertEquals(1, eventLog.lastSequenceNumber("account-1"));
        assertEquals(Optional.of(new AccountState("account-1", 100)), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testStateIsRebuiltFromEventLog() throws Exception {
        InMemoryEventLog<AccountEvent> eventLog = new InMemoryEventLog<>(Accounts.NAME);
        eventLog.append("account-1", 0, List.of(new AccountOpenedEvent("account-1", 100), new DepositedEvent("account-1", 50)));
        dispatcher = dispatcher(Accounts.behavior(), eventLog, 4, Duration.ofSeconds(5));

        assertEquals(Optional.of(new AccountState("account-1", 150)), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));

        ProcessedCommand<AccountEvent, AccountState> withdrawn = accepted(dispatcher.submit(new WithdrawCommand("account-1", 30)));
        assertEquals(3, withdrawn.events().get(0).sequenceNumber());
        assertEquals(new AccountState("account-1", 120), withdrawn.state());
    }

    @Test
    public void testFailedAppendFailsTheTurn() throws Exception {
        @SuppressWarnings("unchecked")
        EventLog<AccountEvent> eventLog = mock(EventLog.class);
        when(eventLog.read("account-1")).thenReturn(List.of());
        when(eventLog.append(eq("account-1"), anyLong(), anyList()))
                .thenThrow(new SequenceMismatchException(Accounts.NAME, "account-1", 0, 1));
        dispatcher = dispatcher(Accounts.behavior(), eventLog, 1, Duration.ofSeconds(5));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> dispatcher.submit(new OpenAccountCommand("account-1", 100)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(SequenceMismatchException.class, exception.getCause());
        verify(eventLog).append(eq("account-1"), eq(0L), anyList());
        assertEquals(Optional.empty(), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testFailedFoldRebuildsStateFromEventLog() throws Exception {
        InMemoryEventLog<AccountEvent> eventLog = new InMemoryEventLog<>(Accounts.NAME);
        AtomicBoolean failNextFold = new AtomicBoolean(true);
        Behavior<AccountCommand, AccountEvent, AccountState> behavior =
                BehaviorDsl.behaviorFor(Accounts.NAME, AccountCommand.class, AccountEvent.class, AccountState.class)
                        .whenConstructing(rules -> rules
                                .handleCommand(OpenAccountCommand.class, cmd -> EventOutcome.of(new AccountOpenedEvent(cmd.accountId(), cmd.initialBalance())))
                                .handleEvent(AccountOpenedEvent.class, event -> new AccountState(event.accountId(), event.balance())))
                        .whenUpdating(rules -> rules
                                .handleCommand(DepositCommand.class,
                                        (cmd, state) -> EventOutcome.single(new DepositedEvent(state.accountId(), cmd.amount())))
                                .handleEvent(DepositedEvent.class, (event, state) -> {
                                    if (event.amount() == 13 && failNextFold.getAndSet(false)) {
                                        throw new IllegalStateException("Unlucky deposit");
                                    }
                                    return state.withBalance(state.balance() + event.amount());
                                }))
                        .build();
        dispatcher = dispatcher(behavior, eventLog, 2, Duration.ofSeconds(5));
        accepted(dispatcher.submit(new OpenAccountCommand("account-1", 100)));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> dispatcher.submit(new DepositCommand("account-1", 13)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals(2, eventLog.lastSequenceNumber("account-1"));

        assertEquals(Optional.of(new AccountState("account-1", 113)), dispatcher.getState("account-1").get(5, TimeUnit.SECONDS));
        ProcessedCommand<AccountEvent, AccountState> deposited = accepted(dispatcher.submit(new DepositCommand("account-1", 7)));
        assertEquals(3, deposited.events().get(0).sequenceNumber());
        assertEquals(new AccountState("account-1", 120), deposited.state());
    }

    @Test
    public void testSubmitAfterCloseFails() {
        dispatcher = dispatcher(Accounts.behavior(), new InMemoryEventLog<>(Accounts.NAME), 2, Duration.ofSeconds(5));
        dispatcher.close();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> dispatcher.submit(new OpenAccountCommand("account-1", 100)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
    }

    @Test
    public void testInvalidNumberOfPartitions() {
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher(Accounts.behavior(), new InMemoryEventLog<>(Accounts.NAME), 0, Duration.ofSeconds(5)));
    }

    private Behavior<AccountCommand, AccountEvent, AccountState> deferredDeposits() {
        return BehaviorDsl.behaviorFor(Accounts.NAME, AccountCommand.class, AccountEvent.class, AccountState.class)
                .whenConstructing(rules -> rules
                        .handleCommand(OpenAccountCommand.class, cmd -> EventOutcome.of(new AccountOpenedEvent(cmd.accountId(), cmd.initialBalance())))
                        .handleEvent(AccountOpenedEvent.class, event -> new AccountState(event.accountId(), event.balance())))
                .whenUpdating(rules -> rules
                        .handleCommand(DepositCommand.class, (cmd, state) -> {
                            balancesSeen.add(state.balance());
                            CompletableFuture<List<AccountEvent>> pending = new CompletableFuture<>();
                            pendingDeposits.add(pending);
                            return EventOutcome.deferred(pending);
                        })
                        .handleCommand(WithdrawCommand.class,
                                (cmd, state) -> EventOutcome.single(new WithdrawalApprovedEvent(state.accountId(), cmd.amount())))
                        .handleEvent(DepositedEvent.class, (event, state) -> state.withBalance(state.balance() + event.amount()))
                        .handleEvent(WithdrawalApprovedEvent.class, (event, state) -> state.withBalance(state.balance() - event.amount())))
                .build();
    }

    private static AggregateDispatcher<AccountCommand, AccountEvent, AccountState> dispatcher(Behavior<AccountCommand, AccountEvent, AccountState> behavior,
                                                                                             EventLog<AccountEvent> eventLog,
                                                                                             int partitions,
                                                                                             Duration validationTimeout) {
        return new AggregateDispatcher<>(behavior,
                eventLog,
                new InMemoryAggregateStateRepository<>(),
                partitions,
                validationTimeout,
                Duration.ofSeconds(1));
    }

    @SuppressWarnings("unchecked")
    private static ProcessedCommand<AccountEvent, AccountState> accepted(CompletableFuture<CommandResult<ProcessedCommand<AccountEvent, AccountState>>> future) throws Exception {
        CommandResult<ProcessedCommand<AccountEvent, AccountState>> result = future.get(5, TimeUnit.SECONDS);
        CommandResult.Accepted<ProcessedCommand<AccountEvent, AccountState>> accepted = assertInstanceOf(CommandResult.Accepted.class, result);
        return accepted.value();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
