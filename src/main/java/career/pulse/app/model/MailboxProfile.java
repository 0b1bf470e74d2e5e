package career.pulse.app.model;

import lombok.Value;

@Value
public class MailboxProfile {
    String email;
    Integer messagesTotal;
    Integer threadsTotal;
}
