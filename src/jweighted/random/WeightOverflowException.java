package jweighted.random;

/**
 * Thrown by a mutation whose resulting total weight would not fit in the
 * unsigned 32-bit weight range. The mutation is not applied.
 */
@SuppressWarnings("serial")
public class WeightOverflowException extends ArithmeticException
{
	public WeightOverflowException()
	{
		super();
	}

	public WeightOverflowException(String message, Throwable cause)
	{
		super(message);
		initCause(cause);
	}

	public WeightOverflowException(String message)
	{
		super(message);
	}

	public WeightOverflowException(Throwable cause)
	{
		super(cause == null ? null : cause.toString());
		initCause(cause);
	}
	
}
