package org.prebid.mobileads.codec;

import io.vertx.core.buffer.Buffer;
import org.prebid.mobileads.exception.AdProtocolException;
import org.prebid.mobileads.model.AdError;
import org.prebid.mobileads.model.AdManagerAdRequest;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.AdSize;
import org.prebid.mobileads.model.LoadAdError;
import org.prebid.mobileads.model.ResponseInfo;
import org.prebid.mobileads.model.RewardItem;
import org.prebid.mobileads.model.ServerSideVerificationOptions;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Extends {@link StandardMessageCodec} with the ad value objects exchanged with the native SDK.
 * <p>
 * Fields are written in declaration order, each as a nested value so that absent optional fields are
 * encoded as null. New types must take a new tag; existing tags and field orders never change.
 */
public class AdMessageCodec extends StandardMessageCodec {

    private static final int AD_SIZE = 128;
    private static final int AD_REQUEST = 129;
    private static final int RESPONSE_INFO = 130;
    private static final int AD_ERROR = 131;
    private static final int REWARD_ITEM = 132;
    private static final int LOAD_AD_ERROR = 133;
    private static final int AD_MANAGER_AD_REQUEST = 134;
    private static final int SERVER_SIDE_VERIFICATION_OPTIONS = 135;

    @Override
    protected void writeValue(Buffer buffer, Object value) {
        if (value instanceof AdSize) {
            final AdSize size = (AdSize) value;
            writeTag(buffer, AD_SIZE);
            writeValue(buffer, size.getWidth());
            writeValue(buffer, size.getHeight());
        } else if (value instanceof AdRequest) {
            final AdRequest request = (AdRequest) value;
            writeTag(buffer, AD_REQUEST);
            writeValue(buffer, request.getKeywords());
            writeValue(buffer, request.getContentUrl());
            writeValue(buffer, request.getNonPersonalizedAds());
        } else if (value instanceof AdManagerAdRequest) {
            final AdManagerAdRequest request = (AdManagerAdRequest) value;
            writeTag(buffer, AD_MANAGER_AD_REQUEST);
            writeValue(buffer, request.getKeywords());
            writeValue(buffer, request.getContentUrl());
            writeValue(buffer, request.getCustomTargeting());
            writeValue(buffer, request.getCustomTargetingLists());
            writeValue(buffer, request.getNonPersonalizedAds());
        } else if (value instanceof ResponseInfo) {
            final ResponseInfo responseInfo = (ResponseInfo) value;
            writeTag(buffer, RESPONSE_INFO);
            writeValue(buffer, responseInfo.getResponseId());
            writeValue(buffer, responseInfo.getMediationAdapterClassName());
        } else if (value instanceof LoadAdError) {
            // must be checked before its AdError parent
            final LoadAdError error = (LoadAdError) value;
            writeTag(buffer, LOAD_AD_ERROR);
            writeAdErrorFields(buffer, error);
            writeValue(buffer, error.getResponseInfo());
        } else if (value instanceof AdError) {
            writeTag(buffer, AD_ERROR);
            writeAdErrorFields(buffer, (AdError) value);
        } else if (value instanceof RewardItem) {
            final RewardItem rewardItem = (RewardItem) value;
            final BigDecimal amount = rewardItem.getAmount();
            writeTag(buffer, REWARD_ITEM);
            writeValue(buffer, amount != null ? amount.toString() : null);
            writeValue(buffer, rewardItem.getType());
        } else if (value instanceof ServerSideVerificationOptions) {
            final ServerSideVerificationOptions options = (ServerSideVerificationOptions) value;
            writeTag(buffer, SERVER_SIDE_VERIFICATION_OPTIONS);
            writeValue(buffer, options.getUserId());
            writeValue(buffer, options.getCustomData());
        } else {
            super.writeValue(buffer, value);
        }
    }

    @Override
    protected Object readValueOfType(int type, BufferReader reader) {
        switch (type) {
            case AD_SIZE:
                return AdSize.of(
                        readRequiredValueAs(reader, Integer.class),
                        readRequiredValueAs(reader, Integer.class));
            case AD_REQUEST:
                return AdRequest.builder()
                        .keywords(readStringList(reader))
                        .contentUrl(readValueAs(reader, String.class))
                        .nonPersonalizedAds(readValueAs(reader, Boolean.class))
                        .build();
            case AD_MANAGER_AD_REQUEST:
                return AdManagerAdRequest.builder()
                        .keywords(readStringList(reader))
                        .contentUrl(readValueAs(reader, String.class))
                        .customTargeting(readStringMap(reader))
                        .customTargetingLists(readStringListMap(reader))
                        .nonPersonalizedAds(readValueAs(reader, Boolean.class))
                        .build();
            case RESPONSE_INFO:
                return ResponseInfo.builder()
                        .responseId(readValueAs(reader, String.class))
                        .mediationAdapterClassName(readValueAs(reader, String.class))
                        .build();
            case AD_ERROR:
                return new AdError(
                        readRequiredValueAs(reader, Integer.class),
                        readValueAs(reader, String.class),
                        readValueAs(reader, String.class));
            case LOAD_AD_ERROR:
                return new LoadAdError(
                        readRequiredValueAs(reader, Integer.class),
                        readValueAs(reader, String.class),
                        readValueAs(reader, String.class),
                        readValueAs(reader, ResponseInfo.class));
            case REWARD_ITEM:
                return RewardItem.of(
                        toAmount(readValueAs(reader, String.class)),
                        readValueAs(reader, String.class));
            case SERVER_SIDE_VERIFICATION_OPTIONS:
                return ServerSideVerificationOptions.of(
                        readValueAs(reader, String.class),
                        readValueAs(reader, String.class));
            default:
                return super.readValueOfType(type, reader);
        }
    }

    private void writeAdErrorFields(Buffer buffer, AdError error) {
        writeValue(buffer, error.getCode());
        writeValue(buffer, error.getDomain());
        writeValue(buffer, error.getMessage());
    }

    private List<String> readStringList(BufferReader reader) {
        return checkedStringList(readValueAs(reader, List.class));
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> readStringMap(BufferReader reader) {
        final Map<?, ?> map = readValueAs(reader, Map.class);
        if (map == null) {
            return null;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            checkType(entry.getKey(), String.class, "map key");
            checkType(entry.getValue(), String.class, "map value");
        }
        return (Map<String, String>) map;
    }

    @SuppressWarnings("unchecked")
    private Map<String, List<String>> readStringListMap(BufferReader reader) {
        final Map<?, ?> map = readValueAs(reader, Map.class);
        if (map == null) {
            return null;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            checkType(entry.getKey(), String.class, "map key");
            checkType(entry.getValue(), List.class, "map value");
            checkedStringList((List<?>) entry.getValue());
        }
        return (Map<String, List<String>>) map;
    }

    @SuppressWarnings("unchecked")
    private static List<String> checkedStringList(List<?> list) {
        if (list == null) {
            return null;
        }
        for (Object element : list) {
            checkType(element, String.class, "list element");
        }
        return (List<String>) list;
    }

    private static void checkType(Object value, Class<?> type, String role) {
        if (!type.isInstance(value)) {
            throw new AdProtocolException(String.format("Message corrupted: expected %s of type %s but got %s",
                    role, type.getSimpleName(), value != null ? value.getClass().getSimpleName() : "null"));
        }
    }

    private static BigDecimal toAmount(String amount) {
        if (amount == null) {
            return null;
        }
        try {
            return new BigDecimal(amount);
        } catch (NumberFormatException e) {
            throw new AdProtocolException("Message corrupted: invalid reward amount " + amount, e);
        }
    }
}
