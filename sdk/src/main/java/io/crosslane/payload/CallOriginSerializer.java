package io.crosslane.payload;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;
import io.crosslane.model.AccountId;

public final class CallOriginSerializer implements BytesSerializer<CallOrigin> {
    private static final CallOriginSerializer serializer = new CallOriginSerializer();

    private CallOriginSerializer() {
        super();
    }

    public static CallOriginSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(CallOrigin origin, BytesWriter writer) {
        writer.putByte(origin.type().code());
        if (origin instanceof SourceAccountOrigin) {
            writer.putBytes(((SourceAccountOrigin) origin).getSourceAccount().toBytes());
        } else if (origin instanceof TargetAccountOrigin) {
            TargetAccountOrigin target = (TargetAccountOrigin) origin;
            writer.putBytes(target.getSourceAccount().toBytes());
            writer.putBytes(target.getTargetAccount().toBytes());
            writer.putVarBytes(target.getSignature());
        }
    }

    @Override
    public CallOrigin parse(BytesReader reader) {
        byte code = reader.getByte();
        if (code == CallOrigin.Type.SOURCE_ROOT.code()) {
            return SourceRootOrigin.INSTANCE;
        } else if (code == CallOrigin.Type.TARGET_ACCOUNT.code()) {
            AccountId source = new AccountId(reader.getBytes(AccountId.LENGTH));
            AccountId target = new AccountId(reader.getBytes(AccountId.LENGTH));
            return new TargetAccountOrigin(source, target, reader.getVarBytes());
        } else if (code == CallOrigin.Type.SOURCE_ACCOUNT.code()) {
            return new SourceAccountOrigin(new AccountId(reader.getBytes(AccountId.LENGTH)));
        }
        throw new IllegalArgumentException(String.format("Input data corrupted: unknown call origin `%d`", code));
    }
}
