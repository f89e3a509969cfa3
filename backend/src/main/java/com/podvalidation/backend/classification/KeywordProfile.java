package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.DocumentType;

import java.util.List;

/**
 * Keyword evidence for one document type. Primary phrases are unambiguous markers, secondary ones
 * are generic terms that only support a decision. A higher {@code priority} wins over a higher raw
 * score when several types carry primary evidence.
 */
public record KeywordProfile(
        DocumentType type,
        List<String> primary,
        List<String> secondary,
        double primaryWeight,
        double secondaryWeight,
        int priority) {

    public KeywordProfile {
        primary = List.copyOf(primary);
        secondary = List.copyOf(secondary);
    }

    /**
     * Profiles in evaluation order. Ties on score resolve to the earlier entry.
     */
    public static final List<KeywordProfile> DEFAULTS = List.of(
            new KeywordProfile(DocumentType.PALLET_NOTIFICATION_LETTER,
                    List.of("pallet notification", "notification letter", "pallet notification letter"),
                    List.of("warehouse stamp", "warehouse signature", "pallet", "notification"),
                    10, 2, 1),
            new KeywordProfile(DocumentType.LOSCAM_DOCUMENT,
                    List.of("loscam", "loscam document", "loscam philippines", "customer transaction"),
                    List.of("pallet exchange", "pallet rental", "customer signature", "exchange", "docket no",
                            "transaction date", "qty sent"),
                    10, 2, 1),
            new KeywordProfile(DocumentType.CUSTOMER_PALLET_RECEIVING,
                    List.of("customer pallet receiving", "pallet receiving", "receiving document", "plate number",
                            "platc number", "received qty", "received quantity"),
                    List.of("received", "pallet receipt", "customer receipt", "returned qty", "returned quantity",
                            "trucker", "loscam", "rppc", "invoice number"),
                    10, 2, 1),
            new KeywordProfile(DocumentType.SHIP_DOCUMENT,
                    List.of("ship document", "shipping document", "dispatch", "shipment document", "shipment"),
                    List.of("dispatch stamp", "time-out", "time out", "security", "carrier", "warehouse address",
                            "gate", "driver", "customer name", "delivered", "dispatch date", "shipper",
                            "consignee", "date and time", "release", "guard on duty", "stamp", "approved",
                            "signature", "address", "remarks"),
                    10, 5, 1),
            new KeywordProfile(DocumentType.INVOICE,
                    List.of("invoice", "invoice no", "invoice number", "inv no"),
                    List.of("po number", "purchase order", "bill to", "invoice date", "total amount"),
                    10, 2, 1),
            new KeywordProfile(DocumentType.RAR,
                    List.of("receiving acknowledgement receipt", "receiving acknowledgment receipt",
                            "cfast receiving acknowledgement", "rar", "r.a.r", "r.a.r.", "r & a r", "r&ar",
                            "receiving and acknowledgment", "receiving & acknowledgment",
                            "receiving and acknowledgement", "receiving acknowledgment",
                            "receiving acknowledgement", "acknowledgment receipt", "acknowledgement receipt",
                            "r & a receipt", "receiving report", "goods received note", "delivery receipt"),
                    List.of("received", "acknowledged", "total cases", "goods received", "qty received",
                            "quantity received", "receiver signature", "received by", "delivery confirmation",
                            "confirmed delivery", "acceptance", "accepted by"),
                    10, 3, 2));
}
