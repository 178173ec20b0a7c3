package com.example.notice.shared.exception;

import com.example.notice.shared.util.Constants;
import lombok.Getter;

/**
 * Failure of a whole delivery channel (as opposed to a single recipient) for one broadcast.
 */
@Getter
public class ChannelDeliveryException extends RuntimeException {

    private final Constants.Channel channel;

    public ChannelDeliveryException(Constants.Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public ChannelDeliveryException(Constants.Channel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
