package career.pulse.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionStatus {
    boolean connected;
    String email;
    String error;

    public static ConnectionStatus connected(String email) {
        return new ConnectionStatus(true, email, null);
    }

    public static ConnectionStatus disconnected(String error) {
        return new ConnectionStatus(false, null, error);
    }
}
