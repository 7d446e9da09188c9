package nl.bytesoflife.deltaboard.document;

@FunctionalInterface
public interface TransactionListener {

    void onTransaction(Transaction transaction);
}
