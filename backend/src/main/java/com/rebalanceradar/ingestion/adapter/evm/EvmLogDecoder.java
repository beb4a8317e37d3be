package com.rebalanceradar.ingestion.adapter.evm;

import com.rebalanceradar.ingestion.adapter.ChainLog;
import com.rebalanceradar.ingestion.event.EventDecodingException;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Array;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.NumericType;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * ABI-decodes a contract log into its event name and named arguments.
 * Addresses are lowercased, integers become decimal strings, arrays become lists.
 */
@Component
public class EvmLogDecoder {

    public record DecodedLog(ContractEventAbi.Definition definition, Map<String, Object> data) {

        public String eventName() {
            return definition.kind().eventName();
        }
    }

    /**
     * @return empty when topic0 is not one of the indexed events
     * @throws EventDecodingException when topic0 is known but topics or data do not match the ABI
     */
    public Optional<DecodedLog> decode(ChainLog log) {
        if (log.topics() == null || log.topics().isEmpty()) {
            return Optional.empty();
        }
        Optional<ContractEventAbi.Definition> found = ContractEventAbi.byTopic(log.topics().get(0));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ContractEventAbi.Definition definition = found.get();
        List<ContractEventAbi.Param> indexed = definition.indexedParams();
        if (log.topics().size() - 1 != indexed.size()) {
            throw new EventDecodingException(definition.kind().eventName() + " expects " + indexed.size()
                    + " indexed topics, got " + (log.topics().size() - 1) + " in tx " + log.transactionHash());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        try {
            for (int i = 0; i < indexed.size(); i++) {
                ContractEventAbi.Param param = indexed.get(i);
                Type<?> value = FunctionReturnDecoder.decodeIndexedValue(log.topics().get(i + 1), param.type());
                data.put(param.name(), toValue(value));
            }
            List<ContractEventAbi.Param> nonIndexed = definition.nonIndexedParams();
            if (!nonIndexed.isEmpty()) {
                List<Type<?>> values = decodeData(log.data() != null ? log.data() : "0x", definition);
                if (values.size() != nonIndexed.size()) {
                    throw new EventDecodingException(definition.kind().eventName() + " data has " + values.size()
                            + " values, expected " + nonIndexed.size() + " in tx " + log.transactionHash());
                }
                for (int i = 0; i < nonIndexed.size(); i++) {
                    data.put(nonIndexed.get(i).name(), toValue(values.get(i)));
                }
            }
        } catch (EventDecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventDecodingException("Cannot decode " + definition.kind().eventName() + " in tx "
                    + log.transactionHash() + ": " + e.getMessage(), e);
        }
        return Optional.of(new DecodedLog(definition, data));
    }

    private static List<Type<?>> decodeData(String data, ContractEventAbi.Definition definition) {
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(data, definition.event().getNonIndexedParameters());
        List<Type<?>> values = new ArrayList<>(decoded.size());
        for (Type<?> value : decoded) {
            values.add(value);
        }
        return values;
    }

    static Object toValue(Type<?> value) {
        if (value instanceof Address address) {
            return address.getValue().toLowerCase(Locale.ROOT);
        }
        if (value instanceof Bool bool) {
            return bool.getValue();
        }
        if (value instanceof Utf8String string) {
            return string.getValue();
        }
        if (value instanceof NumericType number) {
            return number.getValue().toString();
        }
        if (value instanceof Array<?> array) {
            List<Object> items = new ArrayList<>();
            for (Object item : array.getValue()) {
                items.add(toValue((Type<?>) item));
            }
            return items;
        }
        return value.getValue().toString();
    }
}
