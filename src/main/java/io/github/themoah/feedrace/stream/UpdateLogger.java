package io.github.themoah.feedrace.stream;

import com.google.protobuf.ByteString;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateAccount;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateBlock;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateBlockMeta;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateEntry;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateTransaction;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdateTransactionStatus;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs non-racing updates (accounts, transactions, blocks). Has no effect on race state.
 */
public class UpdateLogger {

  private static final Logger log = LoggerFactory.getLogger(UpdateLogger.class);
  private static final HexFormat HEX = HexFormat.of();

  private final String streamName;

  public UpdateLogger(String streamName) {
    this.streamName = streamName;
  }

  public void logAccount(SubscribeUpdateAccount update) {
    if (!update.hasAccount()) {
      log.info("[{}] Account update with no account info, slot={}",
        streamName, Long.toUnsignedString(update.getSlot()));
      return;
    }
    log.info("[{}] Account update: pubkey={}, slot={}, lamports={}",
      streamName,
      hex(update.getAccount().getPubkey()),
      Long.toUnsignedString(update.getSlot()),
      Long.toUnsignedString(update.getAccount().getLamports()));
  }

  public void logTransaction(SubscribeUpdateTransaction update) {
    if (!update.hasTransaction()) {
      log.info("[{}] Transaction update with no transaction info", streamName);
      return;
    }
    log.info("[{}] Transaction update: signature={}, slot={}, vote={}",
      streamName,
      hex(update.getTransaction().getSignature()),
      Long.toUnsignedString(update.getSlot()),
      update.getTransaction().getIsVote());
  }

  public void logTransactionStatus(SubscribeUpdateTransactionStatus update) {
    log.info("[{}] Transaction status: signature={}, slot={}, index={}",
      streamName,
      hex(update.getSignature()),
      Long.toUnsignedString(update.getSlot()),
      Long.toUnsignedString(update.getIndex()));
  }

  public void logBlock(SubscribeUpdateBlock update) {
    log.info("[{}] Block update: slot={}, blockhash={}",
      streamName, Long.toUnsignedString(update.getSlot()), update.getBlockhash());
  }

  public void logBlockMeta(SubscribeUpdateBlockMeta update) {
    log.info("[{}] Block meta update: slot={}, blockhash={}",
      streamName, Long.toUnsignedString(update.getSlot()), update.getBlockhash());
  }

  public void logEntry(SubscribeUpdateEntry update) {
    log.debug("[{}] Entry update: slot={}, index={}",
      streamName, Long.toUnsignedString(update.getSlot()), Long.toUnsignedString(update.getIndex()));
  }

  private static String hex(ByteString bytes) {
    return HEX.formatHex(bytes.toByteArray());
  }
}
