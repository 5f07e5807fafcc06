package decentralabs.staking.service.persistence;

import decentralabs.staking.service.staking.PendingTransfer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class InMemoryPendingTransferStore implements PendingTransferStore {

    private final Map<String, PendingTransfer> transfers = new ConcurrentHashMap<>();

    @Override
    public void put(PendingTransfer transfer) {
        transfers.put(key(transfer.getTransactionHash()), transfer);
    }

    @Override
    public Optional<PendingTransfer> remove(String transactionHash) {
        if (transactionHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(transfers.remove(key(transactionHash)));
    }

    @Override
    public boolean hasPending(String account, PendingTransfer.Kind kind) {
        return transfers.values().stream()
            .anyMatch(t -> t.getKind() == kind && t.getAccount().equals(account));
    }

    @Override
    public List<PendingTransfer> findAll() {
        return transfers.values().stream()
            .sorted(Comparator.comparingLong(PendingTransfer::getRecordedAt))
            .collect(Collectors.toList());
    }

    private static String key(String transactionHash) {
        return transactionHash.trim().toLowerCase(Locale.ROOT);
    }
}
