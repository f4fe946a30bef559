package ingest.datanode.models;

import com.google.common.base.MoreObjects;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A checkpoint in an upstream message-queue channel.
 * The replica never interprets it, it only stores and forwards it.
 */
public class MsgPosition {
    private final String channelName;
    private final String msgId;
    private final long timestamp;

    private MsgPosition(String channelName, String msgId, long timestamp) {
        this.channelName = channelName;
        this.msgId = msgId;
        this.timestamp = timestamp;
    }

    public static MsgPosition of(String channelName, String msgId, long timestamp) {
        checkNotNull(channelName, "channelName should not be null");
        checkNotNull(msgId, "msgId should not be null");
        return new MsgPosition(channelName, msgId, timestamp);
    }

    public String getChannelName() {
        return channelName;
    }

    public String getMsgId() {
        return msgId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        MsgPosition other = (MsgPosition) obj;
        return timestamp == other.timestamp
            && channelName.equals(other.channelName)
            && msgId.equals(other.msgId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelName, msgId, timestamp);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("channelName", channelName)
            .add("msgId", msgId)
            .add("timestamp", timestamp)
            .toString();
    }
}
