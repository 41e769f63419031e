package com.ryuqq.sourcing.testkit.fixture;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.command.CommandValidationException;
import com.ryuqq.sourcing.core.command.EventRecorder;
import com.ryuqq.sourcing.core.model.AggregateId;

/**
 * Sample customer account aggregate with snapshot support.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class CustomerAccount extends EventSourcedAggregate<CustomerAccount> {

    public static final AggregateType<CustomerAccount> TYPE = AggregateType
        .builder("CustomerAccount", CustomerAccount.class, CustomerAccount::new)
        .on("UserNameAcquired", UserNameAcquired.class, (account, event) -> account.userName = event.data().userName())
        .on("EmailAddressChanged", EmailAddressChanged.class, (account, event) ->
            account.emailAddress = event.data().emailAddress())
        .on("RequestedSpam", RequestedSpam.class, (account, event) -> account.noSpam = false)
        .on("RequestedNoSpam", RequestedNoSpam.class, (account, event) -> account.noSpam = true)
        .command("RequestUserName", RequestUserName.class)
        .command("ChangeEmailAddress", ChangeEmailAddress.class)
        .command("RequestSpam", RequestSpam.class)
        .command("RequestNoSpam", RequestNoSpam.class)
        .snapshots(State.class, CustomerAccount::state, CustomerAccount::restore)
        .build();

    private String userName;
    private String emailAddress;
    private boolean noSpam;

    private CustomerAccount(AggregateId id) {
        super(TYPE, id);
    }

    public static CustomerAccount open(AggregateId id, String userName) {
        CustomerAccount account = TYPE.newInstance(id);
        account.apply(new RequestUserName(userName));
        return account;
    }

    public String userName() {
        return userName;
    }

    public String emailAddress() {
        return emailAddress;
    }

    public boolean noSpam() {
        return noSpam;
    }

    private State state() {
        return new State(userName, emailAddress, noSpam);
    }

    private void restore(State state) {
        this.userName = state.userName();
        this.emailAddress = state.emailAddress();
        this.noSpam = state.noSpam();
    }

    /**
     * Snapshot state.
     *
     * @param userName user name
     * @param emailAddress email address
     * @param noSpam whether marketing mail is refused
     */
    public record State(String userName, String emailAddress, boolean noSpam) {
    }

    public record UserNameAcquired(String userName) {
    }

    public record EmailAddressChanged(String emailAddress) {
    }

    public record RequestedSpam() {
    }

    public record RequestedNoSpam() {
    }

    public record RequestUserName(String userName) implements Command<CustomerAccount> {

        @Override
        public void validate(CustomerAccount account) {
            if (userName == null || userName.isBlank()) {
                throw new CommandValidationException("A user name is required.");
            }
        }

        @Override
        public void handle(CustomerAccount account, EventRecorder recorder) {
            recorder.record(new UserNameAcquired(userName));
        }
    }

    public record ChangeEmailAddress(String emailAddress, String etag) implements Command<CustomerAccount> {

        @Override
        public void validate(CustomerAccount account) {
            if (emailAddress == null || !emailAddress.contains("@")) {
                throw new CommandValidationException("A valid email address is required.");
            }
        }

        @Override
        public void handle(CustomerAccount account, EventRecorder recorder) {
            recorder.record(new EmailAddressChanged(emailAddress));
        }
    }

    public record RequestSpam() implements Command<CustomerAccount> {

        @Override
        public void handle(CustomerAccount account, EventRecorder recorder) {
            recorder.record(new RequestedSpam());
        }
    }

    public record RequestNoSpam() implements Command<CustomerAccount> {

        @Override
        public void handle(CustomerAccount account, EventRecorder recorder) {
            recorder.record(new RequestedNoSpam());
        }
    }
}
